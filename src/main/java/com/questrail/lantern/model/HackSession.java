package com.questrail.lantern.model;

import java.util.List;
import java.util.Objects;

/**
 * HackSession
 * -----------------------------------------------------------------------------
 * Immutable per-owner attempt state. At most one live session exists per
 * {@code owner}; stores upsert keyed by owner.
 *
 * <p>Exactly one entry of {@code gameUsers} is flagged correct.
 * {@code triesLeft} never increases over the life of a session.</p>
 */
public final class HackSession
{
    private final String owner;
    private final int stationId;
    private final List<SessionGameUser> gameUsers;
    private final int triesLeft;

    public HackSession(String owner, int stationId, List<SessionGameUser> gameUsers, int triesLeft) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.stationId = stationId;
        this.gameUsers = List.copyOf(gameUsers);
        this.triesLeft = triesLeft;

        long correct = this.gameUsers.stream().filter(SessionGameUser::correct).count();
        if (correct != 1) {
            throw new IllegalArgumentException("exactly one correct game user required, got " + correct);
        }
    }

    public String owner() {
        return owner;
    }

    public int stationId() {
        return stationId;
    }

    public List<SessionGameUser> gameUsers() {
        return gameUsers;
    }

    public int triesLeft() {
        return triesLeft;
    }

    public SessionGameUser correctUser() {
        return gameUsers.stream()
                .filter(SessionGameUser::correct)
                .findFirst()
                .orElseThrow();
    }

    /**
     * One try consumed. Never goes below zero.
     */
    public HackSession withTryConsumed() {
        return new HackSession(owner, stationId, gameUsers, Math.max(0, triesLeft - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HackSession that)) return false;
        return stationId == that.stationId
                && triesLeft == that.triesLeft
                && owner.equals(that.owner)
                && gameUsers.equals(that.gameUsers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, stationId, gameUsers, triesLeft);
    }

    @Override
    public String toString() {
        return "HackSession{owner=" + owner + ", stationId=" + stationId + ", triesLeft=" + triesLeft + '}';
    }
}
