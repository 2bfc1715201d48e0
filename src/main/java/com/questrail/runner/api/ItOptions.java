package com.questrail.runner.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-test options.
 *
 * @param timeout body timeout for this test; takes precedence over the runner configuration
 */
public record ItOptions(Duration timeout)
{
    public ItOptions {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
    }

    public static ItOptions timeoutMs(long millis)
    {
        return new ItOptions(Duration.ofMillis(millis));
    }
}
