package com.questrail.runner.internal.exec;

import com.questrail.runner.api.Callback;
import com.questrail.runner.api.Done;
import com.questrail.runner.internal.time.SystemWallClock;
import com.questrail.runner.observability.LateSettlementEvent;
import com.questrail.runner.observability.RecordingObservabilitySink;
import com.questrail.runner.time.DeterministicScheduler;
import com.questrail.runner.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeoutRacerTest
 * -----------------------------------------------------------------------------
 * Settlement rules of a single raced unit, driven by a manual clock so that the
 * timer fires exactly when the test says so.
 */
class TimeoutRacerTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private TimeoutRacer racer;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        racer = new TimeoutRacer(clock, scheduler, SystemWallClock.INSTANCE, sink);
    }

    @Test
    void synchronousReturnSucceedsAndDisarmsTimer() {
        TimeoutRacer.Race race = racer.race("unit", Callback.fromBlock(() -> clock.advanceMillis(3)),
            Duration.ofMillis(100));

        Outcome outcome = race.outcome().getNow(null);
        assertInstanceOf(Outcome.Success.class, outcome);
        assertEquals(3, outcome.elapsedMs());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void synchronousThrowIsFailureWithOriginalError() {
        IllegalStateException boom = new IllegalStateException("boom");
        TimeoutRacer.Race race = racer.race("unit", Callback.fromBlock(() -> {
            throw boom;
        }), Duration.ofMillis(100));

        Outcome.Failure failure = assertInstanceOf(Outcome.Failure.class, race.outcome().getNow(null));
        assertSame(boom, failure.error());
    }

    @Test
    void failedStageIsUnwrapped() {
        AssertionError cause = new AssertionError("expected");
        CompletableFuture<Void> stage = new CompletableFuture<>();
        TimeoutRacer.Race race = racer.race("unit", Callback.fromAsync(() -> stage), Duration.ofMillis(100));
        assertFalse(race.outcome().isDone());

        stage.completeExceptionally(new CompletionException(cause));

        Outcome.Failure failure = assertInstanceOf(Outcome.Failure.class, race.outcome().getNow(null));
        assertSame(cause, failure.error());
    }

    @Test
    void doneSignalCompletesUnit() {
        AtomicReference<Done> handle = new AtomicReference<>();
        TimeoutRacer.Race race = racer.race("unit", Callback.fromDone(handle::set), Duration.ofMillis(100));
        assertFalse(race.outcome().isDone(), "returning from a done-style body must not complete it");

        clock.advanceMillis(20);
        handle.get().complete();

        Outcome outcome = race.outcome().getNow(null);
        assertInstanceOf(Outcome.Success.class, outcome);
        assertEquals(20, outcome.elapsedMs());
    }

    @Test
    void doneFailWithNullCountsAsSuccess() {
        TimeoutRacer.Race race = racer.race("unit", Callback.fromDone(done -> done.fail(null)), Duration.ofMillis(100));

        assertInstanceOf(Outcome.Success.class, race.outcome().getNow(null));
    }

    @Test
    void firstSignalWinsBetweenDoneAndStage() {
        CompletableFuture<Void> stage = new CompletableFuture<>();
        AtomicReference<Done> handle = new AtomicReference<>();
        Callback both = done -> {
            handle.set(done);
            return stage;
        };
        TimeoutRacer.Race race = racer.race("unit", both, Duration.ofMillis(100));

        handle.get().fail(new RuntimeException("first"));
        stage.complete(null);

        Outcome.Failure failure = assertInstanceOf(Outcome.Failure.class, race.outcome().getNow(null));
        assertEquals("first", failure.error().getMessage());
        assertTrue(sink.getAllEvents().isEmpty(), "settlement after a failure is not a late settlement");
    }

    @Test
    void timerFiresAtDeadlineWithElapsedAtLeastTimeout() {
        TimeoutRacer.Race race = racer.race("slow unit", Callback.fromDone(done -> { }), Duration.ofMillis(50));

        scheduler.advanceMillis(49);
        assertFalse(race.outcome().isDone());

        scheduler.advanceMillis(1);
        Outcome.Timeout timeout = assertInstanceOf(Outcome.Timeout.class, race.outcome().getNow(null));
        assertEquals(50, timeout.timeoutMs());
        assertTrue(timeout.elapsedMs() >= timeout.timeoutMs());
    }

    @Test
    void settlementAfterTimeoutIsReportedAsLate() {
        AtomicReference<Done> handle = new AtomicReference<>();
        TimeoutRacer.Race race = racer.race("slow unit", Callback.fromDone(handle::set), Duration.ofMillis(10));
        scheduler.advanceMillis(10);

        RuntimeException late = new RuntimeException("late");
        handle.get().fail(late);
        handle.get().complete();

        assertInstanceOf(Outcome.Timeout.class, race.outcome().getNow(null));
        var lateEvents = sink.eventsOfType(LateSettlementEvent.class);
        assertEquals(2, lateEvents.size());
        assertEquals("slow unit", lateEvents.get(0).unit());
        assertSame(late, lateEvents.get(0).error());
        assertNull(lateEvents.get(1).error());
    }

    @Test
    void synchronousBodyOverrunningItsDeadlineIsATimeout() {
        TimeoutRacer.Race race = racer.race("busy unit",
            Callback.fromBlock(() -> scheduler.advanceMillis(30)), Duration.ofMillis(25));

        assertInstanceOf(Outcome.Timeout.class, race.outcome().getNow(null));
        assertTrue(sink.hasEventOfType(LateSettlementEvent.class));
    }

    @Test
    void abortSettlesAsCancelledOnlyOnce() {
        TimeoutRacer.Race race = racer.race("unit", Callback.fromDone(done -> { }), Duration.ofMillis(100));

        assertTrue(race.abort());
        assertFalse(race.abort());
        assertInstanceOf(Outcome.Cancelled.class, race.outcome().getNow(null));
        assertEquals(0, scheduler.pendingCount(), "abort disarms the timer");
    }

    @Test
    void zeroTimeoutArmsNoTimer() {
        AtomicReference<Done> handle = new AtomicReference<>();
        TimeoutRacer.Race race = racer.race("unit", Callback.fromDone(handle::set), Duration.ZERO);

        assertEquals(0, scheduler.pendingCount());
        scheduler.advanceMillis(60_000);
        assertFalse(race.outcome().isDone());

        handle.get().complete();
        assertInstanceOf(Outcome.Success.class, race.outcome().getNow(null));
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            racer.race("unit", Callback.fromBlock(() -> { }), Duration.ofMillis(-1)));
    }

    @Test
    void unwrapStripsNestedFutureWrappers() {
        IllegalArgumentException root = new IllegalArgumentException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertSame(root, TimeoutRacer.unwrap(wrapped));
        assertSame(root, TimeoutRacer.unwrap(root));
    }
}
