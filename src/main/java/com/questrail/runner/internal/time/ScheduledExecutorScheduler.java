package com.questrail.runner.internal.time;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} implementation backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the provided {@link MonotonicClock}. The same clock instance must be used
 * by callers that compute deadlines.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the provided executor. Callers are
 * responsible for shutdown; {@link #newTimerExecutor()} creates the daemon
 * executor the test runner uses for timeout timers.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may execute slightly after their deadline, but never before. This is
 * what makes a reported timeout's {@code elapsedMs} at least its configured
 * {@code timeoutMs}.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * Creates a scheduler backed by the given executor.
     *
     * @param executor the underlying scheduled executor service
     * @param clock    the monotonic clock used for delay calculations
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Single-threaded executor whose thread never keeps the JVM alive.
     */
    public static ScheduledExecutorService newTimerExecutor() {
        return Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "questrail-test-runner-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // A deadline in the past is scheduled with zero delay.
        long nowNanos = clock.nowNanos();
        long delayNanos = Math.max(0, deadlineNanos - nowNanos);

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        return new ScheduledFutureCancellable(future);
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // mayInterruptIfRunning=false: a firing timer only completes a future
            return future.cancel(false);
        }
    }
}
