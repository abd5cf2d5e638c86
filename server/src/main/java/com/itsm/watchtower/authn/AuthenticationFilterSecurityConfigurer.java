package com.itsm.watchtower.authn;

import com.itsm.watchtower.spi.ItsmAuthenticationProvider;
import lombok.AllArgsConstructor;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.config.annotation.SecurityConfigurer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.DefaultSecurityFilterChain;
import org.springframework.security.web.context.SecurityContextHolderFilter;

@AllArgsConstructor
public class AuthenticationFilterSecurityConfigurer implements SecurityConfigurer<DefaultSecurityFilterChain, HttpSecurity> {

    private final ItsmAuthenticationProvider authenticationProvider;

    @Override
    public void init(HttpSecurity builder) {
        // the filter needs the shared authentication manager, which only exists at configure time
    }

    @Override
    public void configure(HttpSecurity http) {
        authenticationProvider.initialize(http.getSharedObject(AuthenticationManager.class));
        http.addFilterAfter(new AuthenticationFilter(authenticationProvider), SecurityContextHolderFilter.class);
    }
}
