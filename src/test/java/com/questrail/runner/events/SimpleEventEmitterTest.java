package com.questrail.runner.events;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class SimpleEventEmitterTest {

    private final SimpleEventEmitter<RunnerEvent> emitter = new SimpleEventEmitter<>();

    @Test
    void listenersRunInRegistrationOrderForTheirTypeOnly() {
        List<String> seen = new ArrayList<>();
        emitter.on(RunnerEvent.BeforeTest.class, e -> seen.add("first " + e.title()));
        emitter.on(RunnerEvent.BeforeTest.class, e -> seen.add("second " + e.title()));
        emitter.on(RunnerEvent.AfterTest.class, e -> seen.add("after " + e.title()));

        emitter.emit(new RunnerEvent.BeforeTest("t"));

        assertEquals(List.of("first t", "second t"), seen);
    }

    @Test
    void onceListenerFiresForNextEventOnly() {
        List<String> seen = new ArrayList<>();
        emitter.once(RunnerEvent.TestSkipped.class, e -> seen.add(e.title()));

        emitter.emit(new RunnerEvent.TestSkipped("a"));
        emitter.emit(new RunnerEvent.TestSkipped("b"));

        assertEquals(List.of("a"), seen);
        assertEquals(0, emitter.listenerCount(RunnerEvent.TestSkipped.class));
    }

    @Test
    void offRemovesByListenerReference() {
        List<String> seen = new ArrayList<>();
        Consumer<RunnerEvent.BeforeDescribe> listener = e -> seen.add(e.title());
        emitter.on(RunnerEvent.BeforeDescribe.class, listener);
        emitter.on(RunnerEvent.BeforeDescribe.class, e -> seen.add("other"));

        emitter.off(RunnerEvent.BeforeDescribe.class, listener);
        emitter.emit(new RunnerEvent.BeforeDescribe("d"));

        assertEquals(List.of("other"), seen);
    }

    @Test
    void listenerExceptionReachesEmitter() {
        emitter.on(RunnerEvent.BeforeTest.class, e -> {
            throw new IllegalStateException("listener broke");
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> emitter.emit(new RunnerEvent.BeforeTest("t")));
        assertEquals("listener broke", thrown.getMessage());
    }

    @Test
    void emitAndWaitCompletesWhenEveryAsyncListenerSettles() {
        CompletableFuture<Void> slow = new CompletableFuture<>();
        emitter.onAsync(RunnerEvent.BeforeTestSuccess.class, e -> slow);
        emitter.on(RunnerEvent.BeforeTestSuccess.class, e -> { });

        CompletableFuture<Void> all = emitter.emitAndWaitForCompletion(new RunnerEvent.BeforeTestSuccess("t"));
        assertFalse(all.isDone());

        slow.complete(null);
        assertTrue(all.isDone());
        assertFalse(all.isCompletedExceptionally());
    }

    @Test
    void emitAndWaitFailsWithListenerStageError() {
        emitter.onAsync(RunnerEvent.BeforeTestSuccess.class,
            e -> CompletableFuture.failedFuture(new AssertionError("veto")));

        CompletableFuture<Void> all = emitter.emitAndWaitForCompletion(new RunnerEvent.BeforeTestSuccess("t"));

        CompletionException thrown = assertThrows(CompletionException.class, all::join);
        assertEquals("veto", thrown.getCause().getMessage());
    }

    @Test
    void emitWithoutListenersIsANoOp() {
        assertTrue(emitter.emitAndWaitForCompletion(new RunnerEvent.TestSkipped("x")).isDone());
        assertDoesNotThrow(() -> emitter.emit(new RunnerEvent.TestSkipped("x")));
    }

    @Test
    void clearRemovesEverything() {
        emitter.on(RunnerEvent.BeforeTest.class, e -> fail("cleared listener ran"));
        emitter.clear();

        emitter.emit(new RunnerEvent.BeforeTest("t"));
        assertEquals(0, emitter.listenerCount(RunnerEvent.BeforeTest.class));
    }
}
