package com.questrail.runner.observability;

import com.questrail.runner.api.RunResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RunnerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRunnerObservabilitySink implements RunnerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRunnerObservabilitySink.class);

    @Override
    public void onRunStarted(RunStartedEvent event) {
        log.info("Test run started: {} selected tests", event.selectedTests());
    }

    @Override
    public void onRunFinished(RunFinishedEvent event) {
        RunResults results = event.results();
        log.info("Test run {} in {}ms: {} tests, {} passed, {} failed, {} timed out, {} skipped",
            event.cancelled() ? "cancelled" : "finished",
            results.elapsedTimeMs(),
            results.totalTests(),
            results.totalSuccesses(),
            results.totalFailures(),
            results.totalTimeouts(),
            results.skipped().size());
    }

    @Override
    public void onHookFailure(HookFailureEvent event) {
        log.warn("{} failed in [{}]", event.kind().label(), String.join(" > ", event.scope()), event.error());
    }

    @Override
    public void onLateSettlement(LateSettlementEvent event) {
        if (event.error() != null) {
            log.debug("Ignoring late failure of {}", event.unit(), event.error());
        } else {
            log.debug("Ignoring late completion of {}", event.unit());
        }
    }

    @Override
    public void onError(RunnerErrorEvent event) {
        log.error("Test runner error: {}", event.message(), event.cause());
    }
}
