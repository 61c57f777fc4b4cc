package com.questrail.lantern.core;

import com.questrail.lantern.api.AttemptResult;
import com.questrail.lantern.api.HackView;
import com.questrail.lantern.api.LanternHackingEngine;
import com.questrail.lantern.api.LanternInfo;
import com.questrail.lantern.hack.HackSessionManager;
import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.store.RoundGate;
import com.questrail.lantern.store.StationStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link LanternHackingEngine}: session operations are delegated to the
 * {@link HackSessionManager}; the round overview is read straight from the
 * stores.
 */
public final class LanternEngine implements LanternHackingEngine
{
    private final HackSessionManager sessionManager;
    private final StationStore stations;
    private final RoundGate roundGate;

    public LanternEngine(HackSessionManager sessionManager, StationStore stations, RoundGate roundGate) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.stations = Objects.requireNonNull(stations, "stations");
        this.roundGate = Objects.requireNonNull(roundGate, "roundGate");
    }

    @Override
    public HackView getOrCreateSession(String owner, int stationId) {
        return sessionManager.getOrCreateSession(owner, stationId);
    }

    @Override
    public AttemptResult attempt(String owner, String guess, boolean boosting) {
        return sessionManager.attempt(owner, guess, boosting);
    }

    @Override
    public LanternInfo lanternInfo() {
        LanternRound round = roundGate.currentRound();
        if (!round.isActive()) {
            return LanternInfo.roundOnly(round);
        }

        List<Station> active = new ArrayList<>();
        List<Station> inactive = new ArrayList<>();
        for (Station station : stations.getAllStations()) {
            (station.isActive() ? active : inactive).add(station);
        }
        return new LanternInfo(round, active, inactive);
    }
}
