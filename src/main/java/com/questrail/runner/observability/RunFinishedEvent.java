package com.questrail.runner.observability;

import com.questrail.runner.api.RunResults;

import java.time.Instant;

/**
 * A run finished, either normally or because it was cancelled.
 */
public record RunFinishedEvent(
    Instant timestamp,
    RunResults results,
    boolean cancelled
) {
}
