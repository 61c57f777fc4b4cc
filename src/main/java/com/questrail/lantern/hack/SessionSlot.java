package com.questrail.lantern.hack;

import com.questrail.lantern.model.HackSession;

import java.util.Optional;

/**
 * SessionSlot
 * -----------------------------------------------------------------------------
 * What an owner currently holds: nothing, or a live session on one station.
 *
 * <p>Requesting a hack is an explicit transition on this slot
 * ({@link #onRequest(int)}), which makes a superseded session visible to
 * observers instead of being silently overwritten.</p>
 */
public sealed interface SessionSlot
        permits SessionSlot.Empty, SessionSlot.Active
{
    /**
     * What a hack request on {@code stationId} does to this slot.
     */
    Transition onRequest(int stationId);

    static SessionSlot of(Optional<HackSession> session) {
        return session.<SessionSlot>map(s -> new Active(s.stationId())).orElse(Empty.INSTANCE);
    }

    enum Transition {
        /** No session yet; generate one. */
        CREATE,
        /** Session on another station; discard it and generate one. */
        SUPERSEDE,
        /** Session on the requested station; keep it unchanged. */
        REUSE
    }

    /** Owner holds no session. */
    final class Empty implements SessionSlot {
        public static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public Transition onRequest(int stationId) {
            return Transition.CREATE;
        }

        @Override
        public String toString() {
            return "NoSession";
        }
    }

    /** Owner holds a live session on {@code stationId}. */
    record Active(int stationId) implements SessionSlot {
        @Override
        public Transition onRequest(int requestedStationId) {
            return requestedStationId == stationId ? Transition.REUSE : Transition.SUPERSEDE;
        }

        @Override
        public String toString() {
            return "ActiveSession(" + stationId + ")";
        }
    }
}
