package com.questrail.lantern.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the decay cadence.
 *
 * <h2>Binding invariant</h2>
 * Cadence decisions MUST use a monotonic time source. Wall-clock time
 * (e.g. {@code Instant.now()}) is permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
