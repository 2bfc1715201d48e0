package com.questrail.runner.internal.results;

import com.questrail.runner.api.RunResults;
import com.questrail.runner.api.TestResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    @Test
    void countsEveryAttemptedOutcomeOnce() {
        ResultAggregator aggregator = new ResultAggregator();
        aggregator.record(TestResult.success(List.of("A"), "ok", 1, null));
        aggregator.record(TestResult.failure(List.of("A"), "bad", 2, new AssertionError("x"), null));
        aggregator.record(TestResult.timeout(List.of("A"), "slow", 60, 50, null, null));
        aggregator.record(TestResult.hookFailure(List.of("A"), "\"after\" hook", 0, new RuntimeException()));

        RunResults results = aggregator.snapshot(99);

        assertEquals(99, results.elapsedTimeMs());
        assertEquals(4, results.totalTests());
        assertEquals(1, results.totalSuccesses());
        assertEquals(2, results.totalFailures());
        assertEquals(1, results.totalTimeouts());
        assertEquals(4, results.results().size());
    }

    @Test
    void skippedTestsAreKeptApartAndNotCounted() {
        ResultAggregator aggregator = new ResultAggregator();
        aggregator.record(TestResult.skipped(List.of(), "later", null));
        aggregator.record(TestResult.success(List.of(), "now", 0, null));

        RunResults results = aggregator.snapshot(0);

        assertEquals(1, results.totalTests());
        assertEquals(1, results.results().size());
        assertEquals("later", results.skipped().get(0).title());
    }

    @Test
    void snapshotIsDetachedFromLaterRecords() {
        ResultAggregator aggregator = new ResultAggregator();
        RunResults before = aggregator.snapshot(0);
        aggregator.record(TestResult.success(List.of(), "t", 0, null));

        assertEquals(0, before.totalTests());
        assertTrue(before.results().isEmpty());
    }

    @Test
    void infoViewsSelectByStatus() {
        ResultAggregator aggregator = new ResultAggregator();
        AssertionError error = new AssertionError("nope");
        aggregator.record(TestResult.failure(List.of("S"), "f", 1, error, null));
        aggregator.record(TestResult.timeout(List.of("S"), "t", 12, 10, null, null));

        RunResults results = aggregator.snapshot(13);

        assertEquals(List.of(new RunResults.FailureInfo(List.of("S"), "f", error)), results.failureInfo());
        assertEquals(List.of(new RunResults.TimeoutInfo(List.of("S"), "t", 12, 10)), results.timeoutInfo());
    }

    @Test
    void inconsistentTotalsAreRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            new RunResults(0, 2, 1, 0, 0, List.of(), List.of()));
    }
}
