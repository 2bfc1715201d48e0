package com.questrail.runner.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production timer scheduler.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = ScheduledExecutorScheduler.newTimerExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void timerNeverFiresBeforeItsDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicLong firedAfterNanos = new AtomicLong();
        long start = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAfter(Duration.ofMillis(40), SystemMonotonicClock.INSTANCE, () -> {
            firedAfterNanos.set(SystemMonotonicClock.INSTANCE.nowNanos() - start);
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Timer should fire");
        assertTrue(firedAfterNanos.get() >= TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void pastDeadlineFiresImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
            () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(150);
        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void timerThreadIsDaemonAndNamed() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Thread> thread = new AtomicReference<>();

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> {
            thread.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        assertTrue(thread.get().isDaemon());
        assertEquals("questrail-test-runner-timer", thread.get().getName());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> { }));
    }
}
