package com.questrail.lantern.api;

import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.Station;

import java.util.List;
import java.util.Objects;

/**
 * Current round and, while it is active, the stations split by their
 * {@code isActive} flag. Both lists are empty when the round is inactive.
 */
public record LanternInfo(
        LanternRound round,
        List<Station> activeStations,
        List<Station> inactiveStations
) {
    public LanternInfo {
        Objects.requireNonNull(round, "round");
        activeStations = List.copyOf(activeStations);
        inactiveStations = List.copyOf(inactiveStations);
    }

    public static LanternInfo roundOnly(LanternRound round) {
        return new LanternInfo(round, List.of(), List.of());
    }
}
