package com.questrail.runner.model;

import com.questrail.runner.api.Callback;

import java.util.Objects;

/**
 * A callback tagged with its role. The owning scope is the {@link DescribeNode}
 * whose hook list holds it.
 */
public record Hook(HookKind kind, Callback callback)
{
    public Hook {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(callback, "callback");
    }
}
