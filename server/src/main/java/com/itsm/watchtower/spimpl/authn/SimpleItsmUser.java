package com.itsm.watchtower.spimpl.authn;

import com.itsm.watchtower.spi.authn.ItsmUser;

import java.util.Set;

public record SimpleItsmUser(long id, String name, Set<String> roles) implements ItsmUser {

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<String> getRoles() {
        return roles;
    }
}
