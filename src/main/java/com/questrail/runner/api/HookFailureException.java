package com.questrail.runner.api;

import com.questrail.runner.model.HookKind;

import java.util.List;
import java.util.Objects;

/**
 * HookFailureException
 * -----------------------------------------------------------------------------
 * Error recorded for a test (or a hook record) when a hook, rather than the
 * test body itself, failed. The hook's own error is kept as the cause, untouched.
 */
public class HookFailureException extends RuntimeException
{
    private final HookKind kind;
    private final List<String> describeChain;

    public HookFailureException(HookKind kind, List<String> describeChain, Throwable cause)
    {
        this(kind, describeChain, kind.label() + " failed" + where(describeChain), cause);
    }

    protected HookFailureException(HookKind kind, List<String> describeChain, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.describeChain = List.copyOf(describeChain);
    }

    public HookKind kind()
    {
        return kind;
    }

    /** Describe titles, outermost first, of the scope that owns the hook. */
    public List<String> describeChain()
    {
        return describeChain;
    }

    static String where(List<String> describeChain)
    {
        return describeChain.isEmpty() ? "" : " in " + String.join(" > ", describeChain);
    }
}
