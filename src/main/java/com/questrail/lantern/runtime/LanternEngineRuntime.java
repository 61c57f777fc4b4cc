package com.questrail.lantern.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.lantern.api.LanternHackingEngine;
import com.questrail.lantern.config.LanternEngineConfig;
import com.questrail.lantern.core.LanternEngine;
import com.questrail.lantern.hack.DecoyPayloadBuilder;
import com.questrail.lantern.hack.HackSessionManager;
import com.questrail.lantern.hack.SessionGenerator;
import com.questrail.lantern.internal.time.MonotonicClock;
import com.questrail.lantern.internal.time.MonotonicScheduler;
import com.questrail.lantern.internal.time.ScheduledExecutorScheduler;
import com.questrail.lantern.internal.time.SystemMonotonicClock;
import com.questrail.lantern.internal.time.SystemWallClock;
import com.questrail.lantern.internal.time.WallClock;
import com.questrail.lantern.observability.LanternObservabilitySink;
import com.questrail.lantern.observability.NullObservabilitySink;
import com.questrail.lantern.signal.SignalCalculator;
import com.questrail.lantern.signal.SignalController;
import com.questrail.lantern.signal.SignalDecayLoop;
import com.questrail.lantern.store.CandidatePool;
import com.questrail.lantern.store.HackSessionStore;
import com.questrail.lantern.store.RoundGate;
import com.questrail.lantern.store.StationStore;
import com.questrail.lantern.sync.SignalSyncClient;
import com.questrail.lantern.sync.http.netty.NettyHttpSignalSyncClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LanternEngineRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the hacking engine.
 *
 * <p>Wires the signal controller, the session manager, the decay loop and the
 * scoring-service client from a {@link LanternEngineConfig} and the store
 * ports. When no {@link SignalSyncClient} is supplied, a
 * {@link NettyHttpSignalSyncClient} is created from the sync config and is
 * closed by {@link #stop()}.</p>
 *
 * <p>The engine is usable before {@link #start()}; start only arms the decay
 * loop.</p>
 */
public final class LanternEngineRuntime
{
    private static final Logger log = LoggerFactory.getLogger(LanternEngineRuntime.class);

    private final LanternEngine engine;
    private final SignalDecayLoop decayLoop;
    private final ScheduledExecutorService schedulerExecutor;
    private final AutoCloseable ownedSyncClient;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private LanternEngineRuntime(LanternEngine engine,
                                 SignalDecayLoop decayLoop,
                                 ScheduledExecutorService schedulerExecutor,
                                 AutoCloseable ownedSyncClient)
    {
        this.engine = engine;
        this.decayLoop = decayLoop;
        this.schedulerExecutor = schedulerExecutor;
        this.ownedSyncClient = ownedSyncClient;
    }

    public void start() {
        decayLoop.start();
    }

    /**
     * Stops the decay loop, shuts the scheduler down and closes the sync
     * client if this runtime created it. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        decayLoop.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownedSyncClient != null) {
            try {
                ownedSyncClient.close();
            } catch (Exception e) {
                log.warn("Failed to close signal sync client", e);
            }
        }
    }

    public LanternHackingEngine engine() {
        return engine;
    }

    public SignalDecayLoop decayLoop() {
        return decayLoop;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LanternEngineConfig config = LanternEngineConfig.builder().build();
        private StationStore stationStore;
        private HackSessionStore sessionStore;
        private CandidatePool candidatePool;
        private RoundGate roundGate;
        private SignalSyncClient syncClient;
        private ObjectMapper objectMapper;
        private LanternObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Random random;

        public Builder withConfig(LanternEngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withStationStore(StationStore store) {
            this.stationStore = store;
            return this;
        }

        public Builder withSessionStore(HackSessionStore store) {
            this.sessionStore = store;
            return this;
        }

        public Builder withCandidatePool(CandidatePool pool) {
            this.candidatePool = pool;
            return this;
        }

        public Builder withRoundGate(RoundGate gate) {
            this.roundGate = gate;
            return this;
        }

        /**
         * Uses one object for every store port.
         */
        public <S extends StationStore & HackSessionStore & CandidatePool & RoundGate> Builder withStore(S store) {
            this.stationStore = store;
            this.sessionStore = store;
            this.candidatePool = store;
            this.roundGate = store;
            return this;
        }

        public Builder withSyncClient(SignalSyncClient client) {
            this.syncClient = client;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public Builder withObservabilitySink(LanternObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public LanternEngineRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(stationStore, "stationStore");
            Objects.requireNonNull(sessionStore, "sessionStore");
            Objects.requireNonNull(candidatePool, "candidatePool");
            Objects.requireNonNull(roundGate, "roundGate");
            Objects.requireNonNull(wallClock, "wallClock");

            Random rng = random != null ? random : new SecureRandom();

            // 1. Sync client
            SignalSyncClient client = syncClient;
            AutoCloseable owned = null;
            if (client == null) {
                NettyHttpSignalSyncClient netty = new NettyHttpSignalSyncClient(
                        config.sync(),
                        objectMapper != null ? objectMapper : new ObjectMapper()
                );
                client = netty;
                owned = netty;
            }

            // 2. Signal side
            SignalController controller = new SignalController(
                    stationStore,
                    client,
                    roundGate,
                    new SignalCalculator(config.signalPolicy()),
                    wallClock,
                    observabilitySink,
                    config.decayEnabled()
            );

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledThreadPoolExecutor schedulerExec = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, "lantern-signal-decay");
                t.setDaemon(true);
                return t;
            });
            // a tick re-armed during stop() must not hold up shutdown
            schedulerExec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            SignalDecayLoop loop = new SignalDecayLoop(
                    controller,
                    scheduler,
                    clock,
                    wallClock,
                    config.decayInterval(),
                    observabilitySink
            );

            // 3. Session side
            HackSessionManager manager = new HackSessionManager(
                    sessionStore,
                    candidatePool,
                    controller,
                    new SessionGenerator(rng),
                    new DecoyPayloadBuilder(rng, config.hackPolicy().decoyCount()),
                    config.hackPolicy(),
                    wallClock,
                    observabilitySink
            );

            LanternEngine engine = new LanternEngine(manager, stationStore, roundGate);
            return new LanternEngineRuntime(engine, loop, schedulerExec, owned);
        }
    }
}
