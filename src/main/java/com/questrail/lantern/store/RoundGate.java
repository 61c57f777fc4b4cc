package com.questrail.lantern.store;

import com.questrail.lantern.model.LanternRound;

/**
 * Exposes the externally owned round. The decay loop only runs while the
 * round is active.
 */
public interface RoundGate
{
    LanternRound currentRound();

    default boolean isRoundActive() {
        return currentRound().isActive();
    }
}
