package com.questrail.runner.observability;

import java.time.Instant;

/**
 * A run began.
 *
 * @param selectedTests tests taking part after {@code only} narrowing, skipped ones included
 */
public record RunStartedEvent(
    Instant timestamp,
    int selectedTests
) {
}
