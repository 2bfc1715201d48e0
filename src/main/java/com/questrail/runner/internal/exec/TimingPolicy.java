package com.questrail.runner.internal.exec;

import com.questrail.runner.config.Phase;
import com.questrail.runner.config.TimeoutConfig;
import com.questrail.runner.model.HookKind;
import com.questrail.runner.model.TestNode;

import java.time.Duration;
import java.util.Objects;

/**
 * TimingPolicy
 * -----------------------------------------------------------------------------
 * Resolves the deadline for each unit of work.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>per-test override from {@code ItOptions} (test bodies only)</li>
 *   <li>the phase's own value in {@link TimeoutConfig}</li>
 *   <li>the configured default</li>
 *   <li>{@link #DEFAULT_TIMEOUT}</li>
 * </ol>
 * A resolved {@link Duration#ZERO} means the unit runs without a timer.
 */
public record TimingPolicy(TimeoutConfig timeouts) {

    /** Built-in timeout when nothing else is configured. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);

    public TimingPolicy {
        Objects.requireNonNull(timeouts, "timeouts");
    }

    public Duration forTest(TestNode test) {
        return test.timeoutOverride().orElseGet(() -> forPhase(Phase.IT));
    }

    public Duration forHook(HookKind kind) {
        return forPhase(Phase.of(kind));
    }

    public Duration forPhase(Phase phase) {
        return timeouts.forPhase(phase)
                .or(timeouts::defaultTimeout)
                .orElse(DEFAULT_TIMEOUT);
    }
}
