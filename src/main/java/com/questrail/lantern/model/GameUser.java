package com.questrail.lantern.model;

import java.util.List;
import java.util.Objects;

/**
 * Decoy identity with its candidate passwords, owned by the candidate pool.
 * The password list is never empty and holds no empty password.
 */
public record GameUser(int stationId, String userName, List<String> passwords)
{
    public GameUser {
        Objects.requireNonNull(userName, "userName");
        passwords = List.copyOf(passwords);
        if (passwords.isEmpty()) {
            throw new IllegalArgumentException("game user " + userName + " has no passwords");
        }
        for (String password : passwords) {
            if (password.isEmpty()) {
                throw new IllegalArgumentException("game user " + userName + " has an empty password");
            }
        }
    }
}
