package com.questrail.runner.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Constructor-time configuration of a test runner.
 *
 * @param timeouts        per-phase or uniform timeouts
 * @param stopOnFirstFail stop executing tests after the first failure or timeout
 */
public record TestRunnerConfig(
    TimeoutConfig timeouts,
    boolean stopOnFirstFail
) {
    public TestRunnerConfig {
        Objects.requireNonNull(timeouts, "timeouts");
    }

    public static TestRunnerConfig defaults() {
        return new TestRunnerConfig(TimeoutConfig.unset(), false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TimeoutConfig timeouts = TimeoutConfig.unset();
        private boolean stopOnFirstFail = false;

        public Builder withTimeout(Duration timeout) {
            this.timeouts = TimeoutConfig.uniform(timeout);
            return this;
        }

        public Builder withTimeouts(TimeoutConfig timeouts) {
            this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
            return this;
        }

        public Builder withStopOnFirstFail(boolean stopOnFirstFail) {
            this.stopOnFirstFail = stopOnFirstFail;
            return this;
        }

        public TestRunnerConfig build() {
            return new TestRunnerConfig(timeouts, stopOnFirstFail);
        }
    }
}
