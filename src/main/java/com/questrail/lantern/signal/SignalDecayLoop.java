package com.questrail.lantern.signal;

import com.questrail.lantern.internal.time.Cancellable;
import com.questrail.lantern.internal.time.MonotonicClock;
import com.questrail.lantern.internal.time.MonotonicScheduler;
import com.questrail.lantern.internal.time.WallClock;
import com.questrail.lantern.observability.LanternErrorEvent;
import com.questrail.lantern.observability.LanternObservabilitySink;
import com.questrail.lantern.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SignalDecayLoop
 * =============================================================================
 * Periodic driver of {@link SignalController#decayTick()}.
 *
 * <h2>Cadence</h2>
 * Each tick re-arms the next one {@code interval} after it finished, so ticks
 * never overlap with each other. Whether a tick does anything (active round,
 * decay enabled) is decided by the controller, not here.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()  → arms the first tick one interval from now
 *   loop.stop()   → cancels the pending tick
 * </pre>
 * An interval of {@link Duration#ZERO} means decay is administratively
 * disabled; {@link #start()} then does nothing.
 *
 * <h2>Failure handling</h2>
 * A failing tick is reported to the observability sink and the loop keeps
 * running. There is no per-tick timeout.
 */
public final class SignalDecayLoop
{
    private static final Logger log = LoggerFactory.getLogger(SignalDecayLoop.class);

    private final SignalController controller;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration interval;
    private final LanternObservabilitySink observabilitySink;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Cancellable pending;

    public SignalDecayLoop(SignalController controller,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           WallClock wallClock,
                           Duration interval,
                           LanternObservabilitySink observabilitySink)
    {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative");
        }
    }

    /**
     * Arms the first tick. Idempotent.
     */
    public void start() {
        if (interval.isZero()) {
            log.info("Signal decay disabled (interval 0)");
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Signal decay loop started, interval {}", interval);
            arm();
        }
    }

    /**
     * Cancels the pending tick. A tick already executing completes.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
                pending = null;
            }
            log.info("Signal decay loop stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void arm() {
        pending = scheduler.scheduleAfter(interval, clock, this::tick);
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            controller.decayTick();
        } catch (RuntimeException e) {
            observabilitySink.onError(new LanternErrorEvent(wallClock.now(), "Decay tick failed", e));
        }
        if (running.get()) {
            arm();
        }
    }
}
