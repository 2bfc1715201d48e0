package com.questrail.runner.events;

import java.util.Objects;

/**
 * RunnerEvent
 * -----------------------------------------------------------------------------
 * Lifecycle notices published by the runner while it walks the suite tree.
 *
 * <h2>Ordering</h2>
 * For one test the runner publishes, in order: {@link BeforeTest}, then
 * {@link BeforeTestSuccess} when the test is about to pass, then exactly one of
 * {@link TestSuccess} / {@link TestFail} / {@link TestTimeout}, then
 * {@link AfterTest}. Skipped tests only publish {@link TestSkipped}.
 * Every {@link BeforeDescribe} is matched by an {@link AfterDescribe}.
 *
 * Listeners subscribe by event class through {@link SimpleEventEmitter}.
 */
public sealed interface RunnerEvent
{
    /** Published before the next describe or test if its source file differs from the previous one. */
    record ActiveFileChanged(String path) implements RunnerEvent {
        public ActiveFileChanged {
            Objects.requireNonNull(path, "path");
        }
    }

    /** Published before every evaluated test, ahead of its beforeEach hooks. */
    record BeforeTest(String title) implements RunnerEvent {}

    /**
     * Published with {@code emitAndWaitForCompletion} when a test is about to be
     * recorded as passed. A listener that throws, or returns a stage that fails,
     * turns the test into a failure with that error.
     */
    record BeforeTestSuccess(String title) implements RunnerEvent {}

    /** The test passed. */
    record TestSuccess(String title, long elapsedMs) implements RunnerEvent {}

    /** The test, or one of its hooks, failed. */
    record TestFail(String title, Throwable error, long elapsedMs) implements RunnerEvent {}

    /** The test, or one of its per-test hooks, exceeded its timeout. */
    record TestTimeout(String title, long elapsedMs, long timeoutMs) implements RunnerEvent {}

    /** The test was skipped and not executed. */
    record TestSkipped(String title) implements RunnerEvent {}

    /** Published after every evaluated test, whatever its outcome. */
    record AfterTest(String title, long elapsedMs) implements RunnerEvent {}

    record BeforeDescribe(String title) implements RunnerEvent {}

    /** Elapsed time covers the whole scope including all of its hooks and tests. */
    record AfterDescribe(String title, long elapsedMs) implements RunnerEvent {}
}
