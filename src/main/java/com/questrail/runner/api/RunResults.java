package com.questrail.runner.api;

import java.util.List;
import java.util.Objects;

/**
 * RunResults
 * =============================================================================
 * Aggregated outcome of one {@code run()} (or of the part that completed before
 * {@code cancel()}).
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code totalSuccesses + totalFailures + totalTimeouts == totalTests}</li>
 *   <li>{@code results().size() == totalTests}; skipped tests live only in {@link #skipped()}</li>
 *   <li>Tests excluded by {@code only} appear nowhere.</li>
 * </ul>
 *
 * @param elapsedTimeMs time from the start of the run to its completion
 * @param results       attempted records in completion order
 * @param skipped       skipped tests in traversal order
 */
public record RunResults(
    long elapsedTimeMs,
    int totalTests,
    int totalSuccesses,
    int totalFailures,
    int totalTimeouts,
    List<TestResult> results,
    List<TestResult> skipped
) {
    /** A failed test or hook, located by describe chain and title, with the error it failed with. */
    public record FailureInfo(List<String> describeChain, String title, Throwable error) {}

    /**
     * A timed-out test with its measured and configured durations. {@code elapsedMs}
     * may exceed {@code timeoutMs} under load.
     */
    public record TimeoutInfo(List<String> describeChain, String title, long elapsedMs, long timeoutMs) {}

    public RunResults {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
        if (totalSuccesses + totalFailures + totalTimeouts != totalTests) {
            throw new IllegalArgumentException("totals do not add up to totalTests");
        }
    }

    public static RunResults empty() {
        return new RunResults(0L, 0, 0, 0, 0, List.of(), List.of());
    }

    public List<FailureInfo> failureInfo() {
        return results.stream()
            .filter(r -> r.status() == TestStatus.FAILURE)
            .map(r -> new FailureInfo(r.describeChain(), r.title(), r.error()))
            .toList();
    }

    public List<TimeoutInfo> timeoutInfo() {
        return results.stream()
            .filter(r -> r.status() == TestStatus.TIMEOUT)
            .map(r -> new TimeoutInfo(r.describeChain(), r.title(), r.elapsedMs(), r.timeoutMs()))
            .toList();
    }
}
