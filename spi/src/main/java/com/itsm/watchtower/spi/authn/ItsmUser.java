package com.itsm.watchtower.spi.authn;

import org.springframework.security.core.AuthenticatedPrincipal;

import java.util.Set;

/**
 * Authenticated user of the ITSM back end. The numeric id is what the audit trail records as the actor.
 */
public interface ItsmUser extends AuthenticatedPrincipal {

    /**
     * @return primary key of the user in the users table
     */
    long getId();

    @Override
    String getName();

    /**
     * @return role names without the {@code ROLE_} prefix, e.g. {@code admin}
     */
    Set<String> getRoles();
}
