package com.questrail.runner.internal.exec;

import com.questrail.runner.api.Callback;
import com.questrail.runner.api.Done;
import com.questrail.runner.internal.time.Cancellable;
import com.questrail.runner.internal.time.MonotonicClock;
import com.questrail.runner.internal.time.MonotonicScheduler;
import com.questrail.runner.internal.time.WallClock;
import com.questrail.runner.observability.LateSettlementEvent;
import com.questrail.runner.observability.RunnerObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * TimeoutRacer
 * =============================================================================
 * Races one callback invocation against a deadline.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The timer is armed first, then the callback is invoked on the calling thread.</li>
 *   <li>The first of {done signal, returned stage, synchronous throw, timer,
 *       {@link Race#abort()}} decides the {@link Outcome}; later settlements are
 *       no-ops.</li>
 *   <li>A callback is never forcibly terminated. If it settles after a timeout or
 *       abort decided the outcome, the settlement is handed to the observability
 *       sink and otherwise dropped.</li>
 *   <li>All elapsed times come from the {@link MonotonicClock}.</li>
 * </ul>
 *
 * <p>A synchronous callback that runs past its deadline cannot be interrupted;
 * the timer still settles the race, so once the callback returns the unit is
 * reported as a timeout.</p>
 */
public final class TimeoutRacer {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final RunnerObservabilitySink observabilitySink;

    public TimeoutRacer(MonotonicClock clock,
                        MonotonicScheduler scheduler,
                        WallClock wallClock,
                        RunnerObservabilitySink observabilitySink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Invokes {@code callback} and races it against {@code timeout}.
     *
     * @param unit     description used when reporting a late settlement
     * @param callback the hook or test body
     * @param timeout  deadline; {@link Duration#ZERO} arms no timer
     * @return the race, possibly already settled
     */
    public Race race(String unit, Callback callback, Duration timeout) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }

        Race race = new Race(unit, clock.nowNanos());
        if (!timeout.isZero()) {
            race.timer = scheduler.scheduleAfter(timeout, clock,
                    () -> race.settle(new Outcome.Timeout(timeout, race.elapsedNanos())));
        }

        try {
            CompletionStage<?> stage = callback.invoke(race.done);
            if (stage != null) {
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        race.settle(new Outcome.Failure(unwrap(error), race.elapsedNanos()));
                    } else {
                        race.settle(new Outcome.Success(race.elapsedNanos()));
                    }
                });
            }
        } catch (Throwable t) {
            race.settle(new Outcome.Failure(t, race.elapsedNanos()));
        }
        return race;
    }

    /**
     * Strips the wrappers {@link CompletableFuture} adds around a stage's failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * One in-flight unit of work.
     */
    public final class Race {
        private final String unit;
        private final long startNanos;
        private final CompletableFuture<Outcome> outcome = new CompletableFuture<>();
        private final Done done = new Done() {
            @Override
            public void complete() {
                settle(new Outcome.Success(elapsedNanos()));
            }

            @Override
            public void fail(Throwable error) {
                // fail(null) reads as "done without an error"
                settle(error == null
                        ? new Outcome.Success(elapsedNanos())
                        : new Outcome.Failure(error, elapsedNanos()));
            }
        };

        private volatile Cancellable timer = Cancellable.NONE;

        private Race(String unit, long startNanos) {
            this.unit = unit;
            this.startNanos = startNanos;
        }

        /** Completes exactly once, always normally. */
        public CompletableFuture<Outcome> outcome() {
            return outcome;
        }

        /**
         * Settles the race as {@link Outcome.Cancelled} unless it already settled.
         *
         * @return {@code true} if this call decided the outcome
         */
        public boolean abort() {
            return settle(new Outcome.Cancelled(elapsedNanos()));
        }

        private long elapsedNanos() {
            return clock.nowNanos() - startNanos;
        }

        private boolean settle(Outcome result) {
            if (outcome.complete(result)) {
                timer.cancel();
                return true;
            }
            Outcome decided = outcome.getNow(null);
            boolean decidedEarly = decided instanceof Outcome.Timeout || decided instanceof Outcome.Cancelled;
            if (decidedEarly && (result instanceof Outcome.Success || result instanceof Outcome.Failure)) {
                Throwable error = result instanceof Outcome.Failure failure ? failure.error() : null;
                observabilitySink.onLateSettlement(new LateSettlementEvent(wallClock.now(), unit, error));
            }
            return false;
        }
    }
}
