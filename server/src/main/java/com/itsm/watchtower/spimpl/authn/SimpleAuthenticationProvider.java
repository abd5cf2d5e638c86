package com.itsm.watchtower.spimpl.authn;

import com.itsm.watchtower.configuration.properties.UsersProperties;
import com.itsm.watchtower.spi.ItsmAuthenticationProvider;
import com.itsm.watchtower.spi.authn.ItsmUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.AuthenticationConverter;
import org.springframework.security.web.authentication.www.BasicAuthenticationConverter;

/**
 * A simple implementation of {@link ItsmAuthenticationProvider} that uses Basic Authentication against the users
 * configured under {@code watchtower.users}.
 * The password check is done by the AuthenticationManager so that spring's UserDetailsService can be used for it.
 */
public class SimpleAuthenticationProvider implements ItsmAuthenticationProvider {

    private final AuthenticationConverter authenticationConverter = new BasicAuthenticationConverter();
    private final UsersProperties usersProperties;
    private AuthenticationManager authenticationManager;

    public SimpleAuthenticationProvider(UsersProperties usersProperties) {
        this.usersProperties = usersProperties;
    }

    @Override
    public void initialize(AuthenticationManager authenticationManager) {
        this.authenticationManager = authenticationManager;
    }

    @Override
    public ItsmUser authenticate(HttpServletRequest request) {
        Authentication authRequest = authenticationConverter.convert(request);
        if (authRequest == null) {
            return null;
        }
        Authentication authenticated = authenticationManager.authenticate(authRequest);
        UsersProperties.User user = usersProperties.findByUsername(authenticated.getName())
                .orElseThrow(() -> new BadCredentialsException("Unknown user " + authenticated.getName()));
        return new SimpleItsmUser(user.getId(), user.getUsername(), user.getRoles());
    }
}
