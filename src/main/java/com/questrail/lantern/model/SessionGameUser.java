package com.questrail.lantern.model;

import java.util.Objects;

/**
 * A game user as drawn into a hack session: one committed password, its hint,
 * and whether it is the combination the player must find.
 */
public record SessionGameUser(String userName, String password, PasswordHint passwordHint, boolean correct)
{
    public SessionGameUser {
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(passwordHint, "passwordHint");
    }
}
