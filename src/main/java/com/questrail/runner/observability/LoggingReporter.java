package com.questrail.runner.observability;

import com.questrail.runner.events.RunnerEvent;
import com.questrail.runner.events.SimpleEventEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * LoggingReporter
 * -----------------------------------------------------------------------------
 * Console-style reporter that writes per-test outcomes through SLF4J.
 *
 * <p>Passing and skipped tests log at INFO, failures and timeouts at WARN,
 * describe boundaries at DEBUG. {@link #detach()} removes exactly the listeners
 * {@link #attach()} added.</p>
 */
public final class LoggingReporter
{
    private static final Logger log = LoggerFactory.getLogger(LoggingReporter.class);

    private final SimpleEventEmitter<RunnerEvent> events;

    private final Consumer<RunnerEvent.ActiveFileChanged> onFile =
            e -> log.info("{}", e.path());
    private final Consumer<RunnerEvent.BeforeDescribe> onDescribe =
            e -> log.debug("> {}", e.title());
    private final Consumer<RunnerEvent.AfterDescribe> onDescribeDone =
            e -> log.debug("< {} ({}ms)", e.title(), e.elapsedMs());
    private final Consumer<RunnerEvent.TestSuccess> onSuccess =
            e -> log.info("  PASS {} ({}ms)", e.title(), e.elapsedMs());
    private final Consumer<RunnerEvent.TestFail> onFail =
            e -> log.warn("  FAIL {} ({}ms)", e.title(), e.elapsedMs(), e.error());
    private final Consumer<RunnerEvent.TestTimeout> onTimeout =
            e -> log.warn("  TIMEOUT {} after {}ms (limit {}ms)", e.title(), e.elapsedMs(), e.timeoutMs());
    private final Consumer<RunnerEvent.TestSkipped> onSkipped =
            e -> log.info("  SKIP {}", e.title());

    public LoggingReporter(SimpleEventEmitter<RunnerEvent> events)
    {
        this.events = Objects.requireNonNull(events, "events");
    }

    public LoggingReporter attach()
    {
        events.on(RunnerEvent.ActiveFileChanged.class, onFile);
        events.on(RunnerEvent.BeforeDescribe.class, onDescribe);
        events.on(RunnerEvent.AfterDescribe.class, onDescribeDone);
        events.on(RunnerEvent.TestSuccess.class, onSuccess);
        events.on(RunnerEvent.TestFail.class, onFail);
        events.on(RunnerEvent.TestTimeout.class, onTimeout);
        events.on(RunnerEvent.TestSkipped.class, onSkipped);
        return this;
    }

    public void detach()
    {
        events.off(RunnerEvent.ActiveFileChanged.class, onFile);
        events.off(RunnerEvent.BeforeDescribe.class, onDescribe);
        events.off(RunnerEvent.AfterDescribe.class, onDescribeDone);
        events.off(RunnerEvent.TestSuccess.class, onSuccess);
        events.off(RunnerEvent.TestFail.class, onFail);
        events.off(RunnerEvent.TestTimeout.class, onTimeout);
        events.off(RunnerEvent.TestSkipped.class, onSkipped);
    }
}
