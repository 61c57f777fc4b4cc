package com.questrail.lantern.store.memory;

import com.questrail.lantern.model.GameUser;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.store.CandidatePool;
import com.questrail.lantern.store.HackSessionStore;
import com.questrail.lantern.store.RoundGate;
import com.questrail.lantern.store.StationStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * InMemoryLanternStore
 * =============================================================================
 * Map-backed implementation of every collaborator port the engine consumes.
 *
 * <p>Useful for tests, simulations, and single-process deployments. All maps
 * are concurrent; no operation spans more than one map, so there is no
 * cross-map atomicity.</p>
 *
 * <p>Seeding methods ({@link #putStation(Station)}, {@link #addGameUser(GameUser)},
 * {@link #addFillerPasswords(List)}, {@link #setRound(LanternRound)}) stand in
 * for the administrative surfaces that own that data in production.</p>
 */
public final class InMemoryLanternStore implements StationStore, HackSessionStore, CandidatePool, RoundGate {

    private final Map<Integer, Station> stations = new ConcurrentHashMap<>();
    private final Map<String, HackSession> sessions = new ConcurrentHashMap<>();
    private final Map<Integer, List<GameUser>> gameUsers = new ConcurrentHashMap<>();
    private final List<String> fillerPasswords = new CopyOnWriteArrayList<>();
    private volatile LanternRound round = LanternRound.inactive();

    // ---------------------------------------------------------------------
    // Seeding
    // ---------------------------------------------------------------------

    public InMemoryLanternStore putStation(Station station) {
        stations.put(station.stationId(), Objects.requireNonNull(station, "station"));
        return this;
    }

    public InMemoryLanternStore addGameUser(GameUser gameUser) {
        Objects.requireNonNull(gameUser, "gameUser");
        gameUsers.computeIfAbsent(gameUser.stationId(), id -> new CopyOnWriteArrayList<>()).add(gameUser);
        return this;
    }

    public InMemoryLanternStore addFillerPasswords(List<String> passwords) {
        fillerPasswords.addAll(passwords);
        return this;
    }

    public InMemoryLanternStore setRound(LanternRound round) {
        this.round = Objects.requireNonNull(round, "round");
        return this;
    }

    // ---------------------------------------------------------------------
    // StationStore
    // ---------------------------------------------------------------------

    @Override
    public Optional<Station> getStation(int stationId) {
        return Optional.ofNullable(stations.get(stationId));
    }

    @Override
    public boolean setSignalValue(int stationId, int signalValue) {
        return stations.computeIfPresent(stationId, (id, s) -> s.withSignalValue(signalValue)) != null;
    }

    @Override
    public List<Station> getAllStations() {
        List<Station> all = new ArrayList<>(stations.values());
        all.sort(Comparator.comparingInt(Station::stationId));
        return all;
    }

    // ---------------------------------------------------------------------
    // HackSessionStore
    // ---------------------------------------------------------------------

    @Override
    public Optional<HackSession> getSession(String owner) {
        return Optional.ofNullable(sessions.get(owner));
    }

    @Override
    public void upsertSession(HackSession session) {
        sessions.put(session.owner(), session);
    }

    @Override
    public boolean deleteSession(String owner) {
        return sessions.remove(owner) != null;
    }

    // ---------------------------------------------------------------------
    // CandidatePool
    // ---------------------------------------------------------------------

    @Override
    public List<GameUser> getCandidates(int stationId) {
        return List.copyOf(gameUsers.getOrDefault(stationId, List.of()));
    }

    @Override
    public List<String> getFillerPasswords() {
        return List.copyOf(fillerPasswords);
    }

    // ---------------------------------------------------------------------
    // RoundGate
    // ---------------------------------------------------------------------

    @Override
    public LanternRound currentRound() {
        return round;
    }
}
