package com.questrail.runner.observability;

import com.questrail.runner.model.HookKind;

import java.time.Instant;
import java.util.List;

/**
 * A hook failed or timed out.
 *
 * @param scope describe titles of the scope owning the hook, outermost first
 */
public record HookFailureEvent(
    Instant timestamp,
    HookKind kind,
    List<String> scope,
    Throwable error
) {
}
