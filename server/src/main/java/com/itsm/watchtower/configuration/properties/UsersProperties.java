package com.itsm.watchtower.configuration.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Getter
@Setter
@ConfigurationProperties(prefix = "watchtower")
@Validated
public class UsersProperties {

    @Valid
    private List<User> users = new ArrayList<>();

    public Optional<User> findByUsername(String username) {
        return users.stream().filter(user -> user.getUsername().equals(username)).findFirst();
    }

    @Getter
    @Setter
    public static class User {
        /**
         * id recorded as actor in the audit trail
         */
        @NotNull
        private Long id;
        @NotEmpty
        private String username;
        /**
         * password with encoder prefix, e.g. {noop}secret or {bcrypt}...
         */
        @NotEmpty
        private String password;
        private Set<String> roles = Set.of();
    }
}
