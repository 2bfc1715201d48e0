package com.questrail.runner.internal.results;

import com.questrail.runner.api.RunResults;
import com.questrail.runner.api.TestResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ResultAggregator
 * -----------------------------------------------------------------------------
 * Accumulates result records for one run.
 *
 * <p>Each attempted record increments {@code totalTests} and exactly one of the
 * success, failure or timeout totals. Skipped records are kept apart and never
 * counted.</p>
 *
 * <p>Only the run's scheduler records; snapshots may be taken from any thread.</p>
 */
public final class ResultAggregator
{
    private final List<TestResult> attempted = new ArrayList<>();
    private final List<TestResult> skipped = new ArrayList<>();
    private int successes;
    private int failures;
    private int timeouts;

    public synchronized void record(TestResult result)
    {
        Objects.requireNonNull(result, "result");
        switch (result.status()) {
            case SKIPPED -> {
                skipped.add(result);
                return;
            }
            case SUCCESS -> successes++;
            case FAILURE -> failures++;
            case TIMEOUT -> timeouts++;
        }
        attempted.add(result);
    }

    public synchronized int totalTests()
    {
        return attempted.size();
    }

    public synchronized RunResults snapshot(long elapsedTimeMs)
    {
        return new RunResults(
                elapsedTimeMs,
                attempted.size(),
                successes,
                failures,
                timeouts,
                attempted,
                skipped);
    }
}
