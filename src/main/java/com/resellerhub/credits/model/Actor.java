package com.resellerhub.credits.model;

import lombok.Value;

/**
 * The already-authenticated identity behind a request, as handed over by the gateway.
 */
@Value
public class Actor {
    long id;
    Role role;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
