package com.questrail.runner.internal.exec;

import com.questrail.runner.api.TestInfo;
import com.questrail.runner.internal.results.ResultAggregator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * RunState
 * =============================================================================
 * Transient state of one run: the queue stack, the cancellation flag, the unit
 * in flight and the result accumulator.
 *
 * <h2>Threading</h2>
 * The stack and the results are mutated only by the runner thread. The flags,
 * the in-flight race and the current test are read and written across threads
 * ({@link #cancel()} and {@code getCurrentTestInfo()} come from callers).
 */
public final class RunState
{
    private final long startNanos;
    private final ResultAggregator results = new ResultAggregator();
    private final Deque<ScopeFrame> stack = new ArrayDeque<>();

    private volatile boolean stopping;
    private volatile boolean cancelledByCaller;
    private volatile TimeoutRacer.Race inFlight;
    private volatile TestInfo currentTest;

    private String lastFilePath;

    public RunState(long startNanos)
    {
        this.startNanos = startNanos;
    }

    public long startNanos()
    {
        return startNanos;
    }

    public ResultAggregator results()
    {
        return results;
    }

    Deque<ScopeFrame> stack()
    {
        return stack;
    }

    /**
     * Caller-initiated cancellation: stop between units and abort the unit in flight.
     */
    public void cancel()
    {
        cancelledByCaller = true;
        stopping = true;
        TimeoutRacer.Race race = inFlight;
        if (race != null) {
            race.abort();
        }
    }

    /**
     * Stop-on-first-fail: no further tests start, but the {@code after} hooks of
     * entered scopes still run. Nothing in flight is aborted.
     */
    void requestStop()
    {
        stopping = true;
    }

    public boolean isStopping()
    {
        return stopping;
    }

    public boolean isCancelledByCaller()
    {
        return cancelledByCaller;
    }

    /**
     * Blocks the runner thread until the race settles or the run is cancelled.
     */
    Outcome await(TimeoutRacer.Race race)
    {
        inFlight = race;
        try {
            if (cancelledByCaller) {
                race.abort();
            }
            return race.outcome().join();
        } finally {
            inFlight = null;
        }
    }

    public Optional<TestInfo> currentTest()
    {
        return Optional.ofNullable(currentTest);
    }

    void setCurrentTest(TestInfo info)
    {
        this.currentTest = info;
    }

    /**
     * Records the file of the next node and reports whether it changed.
     */
    boolean switchFile(String filePath)
    {
        if (filePath == null || filePath.equals(lastFilePath)) {
            return false;
        }
        lastFilePath = filePath;
        return true;
    }
}
