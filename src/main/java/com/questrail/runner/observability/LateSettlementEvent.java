package com.questrail.runner.observability;

import java.time.Instant;

/**
 * A unit settled after its outcome was already decided by a timeout or
 * cancellation. The settlement is not reported anywhere else.
 *
 * @param unit  description of the hook or test
 * @param error the late failure, or {@code null} for a late success
 */
public record LateSettlementEvent(
    Instant timestamp,
    String unit,
    Throwable error
) {
}
