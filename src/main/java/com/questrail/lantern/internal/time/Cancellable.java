package com.questrail.lantern.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks.
 *
 * <p>
 * Kept tiny so it can be implemented by a deterministic test scheduler as well
 * as by a JVM {@code ScheduledExecutorService}-backed scheduler.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
