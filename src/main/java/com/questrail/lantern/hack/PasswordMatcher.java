package com.questrail.lantern.hack;

import java.util.Locale;

/**
 * Case-insensitive comparison of a guess against the committed password.
 */
public final class PasswordMatcher
{
    private PasswordMatcher() {}

    public static boolean isMatch(String guess, String password) {
        return normalize(guess).equals(normalize(password));
    }

    /**
     * Number of positions {@code i} where both strings carry the same
     * character, bounded by the shorter string.
     */
    public static int countMatches(String guess, String password) {
        String g = normalize(guess);
        String p = normalize(password);
        int length = Math.min(g.length(), p.length());
        int matches = 0;
        for (int i = 0; i < length; i++) {
            if (g.charAt(i) == p.charAt(i)) {
                matches++;
            }
        }
        return matches;
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
