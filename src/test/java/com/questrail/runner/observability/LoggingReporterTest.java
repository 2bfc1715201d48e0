package com.questrail.runner.observability;

import com.questrail.runner.api.RunResults;
import com.questrail.runner.events.RunnerEvent;
import com.questrail.runner.events.SimpleEventEmitter;
import com.questrail.runner.model.HookKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingReporterTest {

    @Test
    void attachAndDetachAreSymmetric() {
        SimpleEventEmitter<RunnerEvent> emitter = new SimpleEventEmitter<>();
        LoggingReporter reporter = new LoggingReporter(emitter).attach();

        assertEquals(1, emitter.listenerCount(RunnerEvent.TestFail.class));
        assertEquals(1, emitter.listenerCount(RunnerEvent.ActiveFileChanged.class));
        assertDoesNotThrow(() -> {
            emitter.emit(new RunnerEvent.TestSuccess("ok", 3));
            emitter.emit(new RunnerEvent.TestFail("bad", new AssertionError("x"), 4));
            emitter.emit(new RunnerEvent.TestTimeout("slow", 60, 50));
        });

        reporter.detach();

        assertEquals(0, emitter.listenerCount(RunnerEvent.TestFail.class));
        assertEquals(0, emitter.listenerCount(RunnerEvent.TestSuccess.class));
        assertEquals(0, emitter.listenerCount(RunnerEvent.BeforeDescribe.class));
    }

    @Test
    void slf4jSinkAcceptsEveryEvent() {
        Slf4jRunnerObservabilitySink sink = new Slf4jRunnerObservabilitySink();
        Instant now = Instant.EPOCH;

        assertDoesNotThrow(() -> {
            sink.onRunStarted(new RunStartedEvent(now, 2));
            sink.onHookFailure(new HookFailureEvent(now, HookKind.AFTER,
                List.of("A"), new IllegalStateException("x")));
            sink.onLateSettlement(new LateSettlementEvent(now, "unit", null));
            sink.onRunFinished(new RunFinishedEvent(now, RunResults.empty(), false));
            sink.onError(new RunnerErrorEvent(now, "boom", new RuntimeException()));
        });
    }
}
