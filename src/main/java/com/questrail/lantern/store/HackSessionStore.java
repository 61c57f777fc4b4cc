package com.questrail.lantern.store;

import com.questrail.lantern.model.HackSession;

import java.util.Optional;

/**
 * HackSessionStore
 * -----------------------------------------------------------------------------
 * Per-owner session records. {@link #upsertSession(HackSession)} always
 * overwrites, which is what keeps "at most one live session per owner".
 */
public interface HackSessionStore
{
    Optional<HackSession> getSession(String owner);

    void upsertSession(HackSession session);

    /**
     * @return {@code true} if a session was removed
     */
    boolean deleteSession(String owner);
}
