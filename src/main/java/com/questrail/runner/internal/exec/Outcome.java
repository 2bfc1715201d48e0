package com.questrail.runner.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome
 * -----------------------------------------------------------------------------
 * How one raced unit of work (hook or test body) settled.
 */
public sealed interface Outcome
        permits Outcome.Success, Outcome.Failure, Outcome.Timeout, Outcome.Cancelled
{
    /** Monotonic time from invocation until the outcome was decided. */
    long elapsedNanos();

    default long elapsedMs()
    {
        return elapsedNanos() / 1_000_000L;
    }

    /** The unit completed before its deadline. */
    record Success(long elapsedNanos) implements Outcome {}

    /** The unit threw or its stage failed before its deadline; the error is kept verbatim. */
    record Failure(Throwable error, long elapsedNanos) implements Outcome {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    /** The timer fired first. {@code elapsedNanos} is measured at detection and is at least the timeout. */
    record Timeout(Duration timeout, long elapsedNanos) implements Outcome {
        public Timeout {
            Objects.requireNonNull(timeout, "timeout");
        }

        public long timeoutMs()
        {
            return timeout.toMillis();
        }
    }

    /** The run was cancelled while the unit was in flight. */
    record Cancelled(long elapsedNanos) implements Outcome {}
}
