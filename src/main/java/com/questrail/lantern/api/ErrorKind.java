package com.questrail.lantern.api;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Coarse classification of every failure the hacking engine reports.
 *
 * <p>The transport layer that sits in front of the engine renders these to the
 * end user; the engine itself never retries.</p>
 */
public enum ErrorKind
{
    /** Station, session, or candidate does not exist. */
    NOT_FOUND,

    /** A persistence read or write failed. */
    STORAGE,

    /** The push to the external scoring service failed. */
    EXTERNAL,

    /** Malformed caller input (guess, station id, direction flag). */
    INVALID_DATA,

    /** Raised by the authorizer, never by the engine itself. */
    NOT_ALLOWED,

    /** The engine is misconfigured (e.g. missing sync host or key). */
    INTERNAL
}
