package com.questrail.lantern.api;

/**
 * The caller credential is not allowed to run the requested command.
 * Produced by {@code Authorizer} implementations only.
 */
public final class NotAllowedException extends LanternException
{
    public NotAllowedException(String message) {
        super(ErrorKind.NOT_ALLOWED, message);
    }
}
