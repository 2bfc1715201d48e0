package com.questrail.runner.observability;

import java.time.Instant;

/**
 * Record representing an error that aborted a run.
 */
public record RunnerErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
