package com.questrail.runner.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for an armed timeout.
 *
 * <p>
 * Every hook and test body is raced against one of these timers. When the unit
 * settles first, the timer is cancelled so it never reports a stale timeout.
 * The interface is small enough to be implemented by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /** Handle for a unit that runs without a timer. */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
