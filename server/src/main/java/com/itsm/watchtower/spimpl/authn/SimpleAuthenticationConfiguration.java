package com.itsm.watchtower.spimpl.authn;

import com.itsm.watchtower.configuration.properties.UsersProperties;
import com.itsm.watchtower.spi.ItsmAuthenticationProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;

import java.util.List;
import java.util.Locale;

@Configuration
@ConditionalOnMissingBean(ItsmAuthenticationProvider.class)
public class SimpleAuthenticationConfiguration {

    @Bean
    public ItsmAuthenticationProvider simpleAuthenticationProvider(UsersProperties usersProperties) {
        return new SimpleAuthenticationProvider(usersProperties);
    }

    @Bean
    public UserDetailsService userDetailsService(UsersProperties usersProperties) {
        List<UserDetails> users = usersProperties.getUsers().stream()
                .map(user -> User.withUsername(user.getUsername())
                        .password(user.getPassword())
                        .roles(user.getRoles().stream().map(role -> role.toUpperCase(Locale.ROOT)).toArray(String[]::new))
                        .build())
                .toList();
        return new InMemoryUserDetailsManager(users);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }
}
