package com.questrail.lantern.api;

/**
 * Caller input failed validation before reaching the engine.
 */
public final class InvalidDataException extends LanternException
{
    public InvalidDataException(String message) {
        super(ErrorKind.INVALID_DATA, message);
    }
}
