package com.questrail.lantern.api;

import com.questrail.lantern.model.PasswordHint;

import java.util.List;
import java.util.Objects;

/**
 * Client-visible payload of a hack session.
 *
 * <p>{@code passwords} holds the shuffled decoys followed by the two session
 * passwords. Only the correct game user's name and hint are exposed.</p>
 *
 * @param passwords    decoys plus the two session passwords, in that order
 * @param triesLeft    remaining wrong guesses before the session is terminated
 * @param userName     identity of the correct game user
 * @param passwordHint positional hint into the correct password
 * @param stationId    station the session targets
 */
public record HackView(
        List<String> passwords,
        int triesLeft,
        String userName,
        PasswordHint passwordHint,
        int stationId
) {
    public HackView {
        passwords = List.copyOf(passwords);
        Objects.requireNonNull(userName, "userName");
        Objects.requireNonNull(passwordHint, "passwordHint");
    }
}
