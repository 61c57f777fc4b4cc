package com.questrail.lantern.model;

/**
 * Positional hint into a committed password: the character at {@code index}.
 */
public record PasswordHint(int index, char character)
{
    public static PasswordHint of(String password, int index) {
        return new PasswordHint(index, password.charAt(index));
    }
}
