package com.questrail.lantern.store;

import com.questrail.lantern.api.StorageException;
import com.questrail.lantern.model.GameUser;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.store.memory.InMemoryLanternStore;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store double over an {@link InMemoryLanternStore} that throws
 * {@link StorageException} for the operations switched on with
 * {@link #failOn(Operation)}. A failing call leaves the delegate untouched.
 */
public final class FailingLanternStore implements StationStore, HackSessionStore, CandidatePool, RoundGate {

    public enum Operation {
        GET_STATION,
        SET_SIGNAL_VALUE,
        GET_ALL_STATIONS,
        GET_SESSION,
        UPSERT_SESSION,
        DELETE_SESSION,
        GET_CANDIDATES,
        GET_FILLER_PASSWORDS,
        CURRENT_ROUND
    }

    private final InMemoryLanternStore delegate;
    private final Set<Operation> failing = ConcurrentHashMap.newKeySet();

    public FailingLanternStore(InMemoryLanternStore delegate) {
        this.delegate = delegate;
    }

    public FailingLanternStore failOn(Operation operation) {
        failing.add(operation);
        return this;
    }

    public void recover() {
        failing.clear();
    }

    private void check(Operation operation) {
        if (failing.contains(operation)) {
            throw new StorageException("store unavailable: " + operation);
        }
    }

    @Override
    public Optional<Station> getStation(int stationId) {
        check(Operation.GET_STATION);
        return delegate.getStation(stationId);
    }

    @Override
    public boolean setSignalValue(int stationId, int signalValue) {
        check(Operation.SET_SIGNAL_VALUE);
        return delegate.setSignalValue(stationId, signalValue);
    }

    @Override
    public List<Station> getAllStations() {
        check(Operation.GET_ALL_STATIONS);
        return delegate.getAllStations();
    }

    @Override
    public Optional<HackSession> getSession(String owner) {
        check(Operation.GET_SESSION);
        return delegate.getSession(owner);
    }

    @Override
    public void upsertSession(HackSession session) {
        check(Operation.UPSERT_SESSION);
        delegate.upsertSession(session);
    }

    @Override
    public boolean deleteSession(String owner) {
        check(Operation.DELETE_SESSION);
        return delegate.deleteSession(owner);
    }

    @Override
    public List<GameUser> getCandidates(int stationId) {
        check(Operation.GET_CANDIDATES);
        return delegate.getCandidates(stationId);
    }

    @Override
    public List<String> getFillerPasswords() {
        check(Operation.GET_FILLER_PASSWORDS);
        return delegate.getFillerPasswords();
    }

    @Override
    public LanternRound currentRound() {
        check(Operation.CURRENT_ROUND);
        return delegate.currentRound();
    }
}
