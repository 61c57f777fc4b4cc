package com.questrail.lantern.config;

/**
 * Parameters of the password-guessing session.
 *
 * @param triesBudget          wrong guesses tolerated before the session is terminated
 * @param decoyCount           filler passwords placed in front of the session passwords
 * @param candidatesPerSession game users drawn from the station's pool
 */
public record HackPolicy(int triesBudget, int decoyCount, int candidatesPerSession) {

    public HackPolicy {
        if (triesBudget < 1) {
            throw new IllegalArgumentException("triesBudget must be >= 1");
        }
        if (decoyCount < 0) {
            throw new IllegalArgumentException("decoyCount must be >= 0");
        }
        if (candidatesPerSession < 1) {
            throw new IllegalArgumentException("candidatesPerSession must be >= 1");
        }
    }

    public static HackPolicy defaults() {
        return new HackPolicy(3, 13, 2);
    }

    public HackPolicy withTriesBudget(int tries) {
        return new HackPolicy(tries, decoyCount, candidatesPerSession);
    }
}
