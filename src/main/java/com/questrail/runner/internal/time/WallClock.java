package com.questrail.runner.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * It MUST NOT be used for timeouts or reported durations.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
