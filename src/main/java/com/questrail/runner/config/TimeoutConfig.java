package com.questrail.runner.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TimeoutConfig
 * -----------------------------------------------------------------------------
 * Timeout settings for the units the runner races against a deadline.
 *
 * <p>Either a single value applied to every phase ({@link #uniform(Duration)}),
 * or individual values per {@link Phase}, optionally on top of a default. Unset
 * phases fall back to the default and then to the runner's built-in timeout.</p>
 *
 * <p>{@link Duration#ZERO} disables the timer for the phase.</p>
 */
public final class TimeoutConfig
{
    private static final TimeoutConfig UNSET = new TimeoutConfig(null, Map.of());

    private final Duration defaultTimeout;
    private final Map<Phase, Duration> perPhase;

    private TimeoutConfig(Duration defaultTimeout, Map<Phase, Duration> perPhase)
    {
        this.defaultTimeout = defaultTimeout;
        this.perPhase = perPhase.isEmpty() ? Map.of() : new EnumMap<>(perPhase);
    }

    /** No explicit timeouts; the built-in default applies everywhere. */
    public static TimeoutConfig unset()
    {
        return UNSET;
    }

    /** The same timeout for {@code it}, {@code before}, {@code beforeEach}, {@code after} and {@code afterEach}. */
    public static TimeoutConfig uniform(Duration timeout)
    {
        return new TimeoutConfig(requireNonNegative(timeout, "timeout"), Map.of());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /** The value configured for exactly this phase, if any. */
    public Optional<Duration> forPhase(Phase phase)
    {
        return Optional.ofNullable(perPhase.get(Objects.requireNonNull(phase, "phase")));
    }

    /** The value applied to phases without their own setting, if any. */
    public Optional<Duration> defaultTimeout()
    {
        return Optional.ofNullable(defaultTimeout);
    }

    static Duration requireNonNegative(Duration value, String name)
    {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
        return value;
    }

    @Override
    public String toString()
    {
        return "TimeoutConfig[default=" + defaultTimeout + ", perPhase=" + perPhase + "]";
    }

    public static final class Builder
    {
        private Duration defaultTimeout;
        private final Map<Phase, Duration> perPhase = new EnumMap<>(Phase.class);

        public Builder withDefault(Duration timeout)
        {
            this.defaultTimeout = requireNonNegative(timeout, "default");
            return this;
        }

        public Builder with(Phase phase, Duration timeout)
        {
            perPhase.put(Objects.requireNonNull(phase, "phase"), requireNonNegative(timeout, phase.id()));
            return this;
        }

        public Builder it(Duration timeout)
        {
            return with(Phase.IT, timeout);
        }

        public Builder before(Duration timeout)
        {
            return with(Phase.BEFORE, timeout);
        }

        public Builder beforeEach(Duration timeout)
        {
            return with(Phase.BEFORE_EACH, timeout);
        }

        public Builder after(Duration timeout)
        {
            return with(Phase.AFTER, timeout);
        }

        public Builder afterEach(Duration timeout)
        {
            return with(Phase.AFTER_EACH, timeout);
        }

        public TimeoutConfig build()
        {
            if (defaultTimeout == null && perPhase.isEmpty()) {
                return UNSET;
            }
            return new TimeoutConfig(defaultTimeout, perPhase);
        }
    }
}
