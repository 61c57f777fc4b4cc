package com.questrail.lantern.signal;

import com.questrail.lantern.api.ExternalSyncException;
import com.questrail.lantern.api.LanternException;
import com.questrail.lantern.api.NotFoundException;
import com.questrail.lantern.internal.concurrent.KeyedLocks;
import com.questrail.lantern.internal.time.WallClock;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.observability.LanternErrorEvent;
import com.questrail.lantern.observability.LanternObservabilitySink;
import com.questrail.lantern.observability.NullObservabilitySink;
import com.questrail.lantern.observability.SignalChangeEvent;
import com.questrail.lantern.observability.SyncResultEvent;
import com.questrail.lantern.store.RoundGate;
import com.questrail.lantern.store.StationStore;
import com.questrail.lantern.sync.SignalReport;
import com.questrail.lantern.sync.SignalSyncClient;
import com.questrail.lantern.sync.SyncReceipt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SignalController
 * =============================================================================
 * Owner of every write to a station's signal value.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #adjust(int, boolean)}: one bounded player-driven step, reachable
 *       only through a successful hack attempt</li>
 *   <li>{@link #decayTick()}: one background step toward the default for every
 *       station, driven by {@link SignalDecayLoop}</li>
 * </ul>
 *
 * <h2>Threading model</h2>
 * Adjustments and decay steps race against each other. Every read-modify-write
 * of a station value runs under that station's lock, so concurrent writers on
 * the same station are applied one after the other and none is lost.
 * Different stations never contend.
 * <p>
 * The push to the scoring service runs after the lock is released. Two pushes
 * for the same station may therefore arrive out of order at the service; the
 * store remains authoritative.
 *
 * <h2>Write then push</h2>
 * The value is persisted first. A failing push is reported as
 * {@link AdjustmentOutcome.SyncFailed} and never rolls the write back.
 */
public final class SignalController
{
    private final StationStore stations;
    private final SignalSyncClient syncClient;
    private final RoundGate roundGate;
    private final SignalCalculator calculator;
    private final WallClock wallClock;
    private final LanternObservabilitySink observabilitySink;
    private final boolean decayEnabled;

    private final KeyedLocks<Integer> stationLocks = new KeyedLocks<>();

    public SignalController(StationStore stations,
                            SignalSyncClient syncClient,
                            RoundGate roundGate,
                            SignalCalculator calculator,
                            WallClock wallClock,
                            LanternObservabilitySink observabilitySink,
                            boolean decayEnabled)
    {
        this.stations = Objects.requireNonNull(stations, "stations");
        this.syncClient = Objects.requireNonNull(syncClient, "syncClient");
        this.roundGate = Objects.requireNonNull(roundGate, "roundGate");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.decayEnabled = decayEnabled;
    }

    /**
     * Moves the station's value one bounded step up ({@code boosting}) or down,
     * persists it, and pushes it to the scoring service.
     *
     * @throws NotFoundException if the station does not exist
     * @throws com.questrail.lantern.api.StorageException if the read or write fails
     */
    public AdjustmentOutcome adjust(int stationId, boolean boosting) {
        Write write = stationLocks.withLock(stationId, () -> {
            Station station = stations.getStation(stationId)
                    .orElseThrow(() -> new NotFoundException("station " + stationId));
            int newValue = calculator.adjust(station.signalValue(), boosting);
            persist(stationId, newValue);
            return new Write(stationId, station.signalValue(), newValue);
        });

        observabilitySink.onSignalChanged(new SignalChangeEvent(
                wallClock.now(), stationId, write.previousValue(), write.newValue(), SignalChangeEvent.Cause.ADJUST));

        return push(write);
    }

    /**
     * Moves every station one unit toward the default.
     *
     * <p>Returns immediately with no outcomes while decay is disabled or no
     * round is active. A failure on one station is reported to the
     * observability sink and does not prevent the others from decaying.</p>
     *
     * @return one outcome per station whose value changed
     * @throws com.questrail.lantern.api.StorageException if listing the stations fails
     */
    public List<AdjustmentOutcome> decayTick() {
        if (!decayEnabled || !roundGate.isRoundActive()) {
            return List.of();
        }

        List<AdjustmentOutcome> outcomes = new ArrayList<>();
        for (Station listed : stations.getAllStations()) {
            int stationId = listed.stationId();
            try {
                Write write = stationLocks.withLock(stationId, () -> decayLocked(stationId));
                if (write == null) {
                    continue;
                }
                observabilitySink.onSignalChanged(new SignalChangeEvent(
                        wallClock.now(), stationId, write.previousValue(), write.newValue(), SignalChangeEvent.Cause.DECAY));
                outcomes.add(push(write));
            } catch (LanternException e) {
                observabilitySink.onError(new LanternErrorEvent(
                        wallClock.now(), "Decay failed for station " + stationId, e));
            }
        }
        return outcomes;
    }

    /**
     * Re-reads under the lock so a concurrent adjustment is never overwritten
     * with the stale listed value.
     */
    private Write decayLocked(int stationId) {
        Station station = stations.getStation(stationId).orElse(null);
        if (station == null) {
            return null;
        }
        int previous = station.signalValue();
        int next = calculator.decay(previous);
        if (next == previous) {
            return null;
        }
        persist(stationId, next);
        return new Write(stationId, previous, next);
    }

    private void persist(int stationId, int value) {
        if (!stations.setSignalValue(stationId, value)) {
            throw new NotFoundException("station " + stationId);
        }
    }

    private AdjustmentOutcome push(Write write) {
        SignalReport report = new SignalReport(write.stationId(), write.newValue());
        try {
            SyncReceipt receipt = syncClient.push(report);
            observabilitySink.onSyncResult(new SyncResultEvent(wallClock.now(), report, receipt.statusCode()));
            return new AdjustmentOutcome.Committed(write.stationId(), write.previousValue(), write.newValue(), receipt);
        } catch (ExternalSyncException e) {
            observabilitySink.onError(new LanternErrorEvent(
                    wallClock.now(), "Signal push failed for station " + write.stationId(), e));
            return new AdjustmentOutcome.SyncFailed(write.stationId(), write.previousValue(), write.newValue(), e);
        }
    }

    private record Write(int stationId, int previousValue, int newValue) {}
}
