package com.questrail.lantern.api;

/**
 * A station, hack session, or set of game users does not exist.
 */
public final class NotFoundException extends LanternException
{
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
