package com.questrail.lantern.auth;

import java.util.Objects;

/**
 * Caller identity produced by an {@link Authorizer}.
 */
public record AuthorizedUser(String userName, int accessLevel) {

    public AuthorizedUser {
        Objects.requireNonNull(userName, "userName");
    }
}
