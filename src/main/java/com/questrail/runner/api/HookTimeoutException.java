package com.questrail.runner.api;

import com.questrail.runner.model.HookKind;

import java.util.List;

/**
 * A {@code before} or {@code after} hook did not settle within its timeout.
 */
public class HookTimeoutException extends HookFailureException
{
    private final long timeoutMs;
    private final long elapsedMs;

    public HookTimeoutException(HookKind kind, List<String> describeChain, long timeoutMs, long elapsedMs)
    {
        super(kind, describeChain,
                kind.label() + " timed out after " + elapsedMs + "ms (timeout " + timeoutMs + "ms)"
                        + where(describeChain),
                null);
        this.timeoutMs = timeoutMs;
        this.elapsedMs = elapsedMs;
    }

    public long timeoutMs()
    {
        return timeoutMs;
    }

    public long elapsedMs()
    {
        return elapsedMs;
    }
}
