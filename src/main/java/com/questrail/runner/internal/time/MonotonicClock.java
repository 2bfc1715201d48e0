package com.questrail.runner.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every elapsed-time measurement the runner reports.
 *
 * <h2>Binding invariant</h2>
 * Timeouts, test durations and describe durations MUST use a monotonic time
 * source. Wall-clock time (e.g. {@code Instant.now()}) is permitted only for
 * log timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();

    /**
     * Whole milliseconds elapsed since {@code startNanos}.
     */
    default long millisSince(long startNanos)
    {
        return (nowNanos() - startNanos) / 1_000_000L;
    }
}
