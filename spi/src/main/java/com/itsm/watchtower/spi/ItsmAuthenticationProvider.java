package com.itsm.watchtower.spi;

import com.itsm.watchtower.spi.authn.ItsmUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AuthenticationManager;

/**
 * Interface for an authentication provider of the ITSM back end.
 * If there are multiple authentication providers, the bean with {@code @Primary} annotation is picked.
 */
public interface ItsmAuthenticationProvider {

    default void initialize(AuthenticationManager authenticationManager) {
        // no-op; override if you need the manager
    }

    /**
     * Authenticate the request.
     * If returned object is null, the request will be continued and might fail later if the api is not open.
     * If an AuthenticationException is thrown, the request will be rejected right away.
     */
    ItsmUser authenticate(HttpServletRequest request);
}
