package com.questrail.lantern.api;

/**
 * A persistence read or write failed. State is left as it was before the
 * failing call unless documented otherwise by the caller.
 */
public final class StorageException extends LanternException
{
    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
