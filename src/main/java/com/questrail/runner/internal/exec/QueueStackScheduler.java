package com.questrail.runner.internal.exec;

import com.questrail.runner.api.HookFailureException;
import com.questrail.runner.api.HookTimeoutException;
import com.questrail.runner.api.TestInfo;
import com.questrail.runner.api.TestResult;
import com.questrail.runner.events.EventPublisher;
import com.questrail.runner.events.RunnerEvent;
import com.questrail.runner.internal.time.MonotonicClock;
import com.questrail.runner.internal.time.WallClock;
import com.questrail.runner.model.DescribeNode;
import com.questrail.runner.model.FocusFilter;
import com.questrail.runner.model.Hook;
import com.questrail.runner.model.HookKind;
import com.questrail.runner.model.Modifier;
import com.questrail.runner.model.SuiteNode;
import com.questrail.runner.model.TestNode;
import com.questrail.runner.observability.HookFailureEvent;
import com.questrail.runner.observability.RunnerObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * QueueStackScheduler
 * =============================================================================
 * Walks the describe/it tree exactly once, in declaration order, with explicit
 * pre- and post-order hook injection.
 *
 * <h2>Model</h2>
 * Instead of recursing, the scheduler keeps a stack of {@link ScopeFrame}s, one
 * per open describe scope. Every loop iteration performs a single unit of work
 * for the top frame (one hook, one test, one push or one pop), and the stop flag
 * is checked before each iteration. Cancellation therefore never waits for a
 * whole scope to unwind.
 *
 * <h2>Per scope</h2>
 * <ol>
 *   <li>publish {@code BeforeDescribe}</li>
 *   <li>{@code before} hooks in order; the first failure fails every selected
 *       descendant test without running it</li>
 *   <li>children in declaration order; nested describes are pushed, tests are
 *       sandwiched between the beforeEach chain (outer to inner) and the
 *       afterEach chain (inner to outer)</li>
 *   <li>{@code after} hooks in order, each attempted even if an earlier one failed</li>
 *   <li>publish {@code AfterDescribe} with the elapsed time of the whole scope</li>
 * </ol>
 *
 * <h2>Stopping</h2>
 * After stop-on-first-fail every test not yet reached is recorded as skipped and
 * each entered scope goes straight to its {@code after} hooks, which still run.
 * After caller cancellation the open scopes are closed without running further
 * hooks.
 */
public final class QueueStackScheduler {

    private final DescribeNode root;
    private final RunState state;
    private final TimingPolicy timingPolicy;
    private final boolean stopOnFirstFail;
    private final TimeoutRacer racer;
    private final EventPublisher<RunnerEvent> events;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RunnerObservabilitySink observabilitySink;

    public QueueStackScheduler(DescribeNode root,
                               RunState state,
                               TimingPolicy timingPolicy,
                               boolean stopOnFirstFail,
                               TimeoutRacer racer,
                               EventPublisher<RunnerEvent> events,
                               MonotonicClock clock,
                               WallClock wallClock,
                               RunnerObservabilitySink observabilitySink)
    {
        this.root = Objects.requireNonNull(root, "root");
        this.state = Objects.requireNonNull(state, "state");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.stopOnFirstFail = stopOnFirstFail;
        this.racer = Objects.requireNonNull(racer, "racer");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Runs the whole tree on the calling thread. Returns when every scope has been
     * closed, normally or by stopping. Listener exceptions propagate.
     */
    public void execute() {
        state.stack().push(newFrame(root));

        while (!state.stack().isEmpty()) {
            if (state.isCancelledByCaller()) {
                drain();
                return;
            }

            ScopeFrame frame = state.stack().peek();
            if (state.isStopping() && windDown(frame)) {
                continue;
            }
            switch (frame.stage()) {
                case ENTER -> enter(frame);
                case BEFORE_HOOKS -> runNextBeforeHook(frame);
                case CHILDREN -> runNextChild(frame);
                case AFTER_HOOKS -> runNextAfterHook(frame);
                case EXIT -> exit(frame);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Scope stages
    // ---------------------------------------------------------------------

    private void enter(ScopeFrame frame) {
        DescribeNode scope = frame.scope();
        if (!scope.isRoot()) {
            announceFile(scope);
            events.emit(new RunnerEvent.BeforeDescribe(scope.title()));
        }
        frame.advanceTo(ScopeFrame.Stage.BEFORE_HOOKS);
    }

    private void runNextBeforeHook(ScopeFrame frame) {
        List<Hook> hooks = frame.scope().hooks(HookKind.BEFORE);
        if (frame.nextHook() >= hooks.size()) {
            frame.advanceTo(ScopeFrame.Stage.CHILDREN);
            return;
        }

        Hook hook = hooks.get(frame.nextHook());
        Outcome outcome = runHook(hook, frame.scope());
        if (outcome instanceof Outcome.Cancelled) {
            return;
        }
        frame.hookDone();

        HookFailureException failure = hookFailure(HookKind.BEFORE, frame.scope(), outcome);
        if (failure != null) {
            frame.failBefore(failure);
            frame.advanceTo(ScopeFrame.Stage.CHILDREN);
        }
    }

    private void runNextChild(ScopeFrame frame) {
        if (frame.beforeFailure() != null) {
            failRemainingChildren(frame, frame.beforeFailure());
            frame.advanceTo(ScopeFrame.Stage.AFTER_HOOKS);
            return;
        }
        if (!frame.hasNextChild()) {
            frame.advanceTo(ScopeFrame.Stage.AFTER_HOOKS);
            return;
        }

        SuiteNode child = frame.takeNextChild();
        if (child instanceof DescribeNode describe) {
            if (describe.modifier() == Modifier.SKIP) {
                skipAll(FocusFilter.select(describe));
            } else {
                state.stack().push(newFrame(describe));
            }
        } else if (child instanceof TestNode test) {
            if (test.modifier() == Modifier.SKIP) {
                skip(test);
            } else {
                runTest(test);
            }
        }
    }

    private void runNextAfterHook(ScopeFrame frame) {
        List<Hook> hooks = frame.scope().hooks(HookKind.AFTER);
        if (frame.nextHook() >= hooks.size()) {
            frame.advanceTo(ScopeFrame.Stage.EXIT);
            return;
        }

        Hook hook = hooks.get(frame.nextHook());
        Outcome outcome = runHook(hook, frame.scope());
        if (outcome instanceof Outcome.Cancelled) {
            return;
        }
        frame.hookDone();

        HookFailureException failure = hookFailure(HookKind.AFTER, frame.scope(), outcome);
        if (failure != null) {
            state.results().record(TestResult.hookFailure(
                    frame.scope().scopeChain(), HookKind.AFTER.label(), outcome.elapsedMs(), failure));
        }
    }

    private void exit(ScopeFrame frame) {
        state.stack().pop();
        DescribeNode scope = frame.scope();
        if (!scope.isRoot()) {
            events.emit(new RunnerEvent.AfterDescribe(scope.title(), clock.millisSince(frame.startNanos())));
        }
    }

    /**
     * Stop-on-first-fail: skips the frame's unreached children and moves it on to
     * its {@code after} hooks. Returns {@code true} if the frame was popped instead.
     */
    private boolean windDown(ScopeFrame frame) {
        switch (frame.stage()) {
            case ENTER -> {
                state.stack().pop();
                skipAll(frame.remainingChildren());
                return true;
            }
            case BEFORE_HOOKS, CHILDREN -> {
                skipAll(frame.remainingChildren());
                frame.skipRemainingChildren();
                frame.advanceTo(ScopeFrame.Stage.AFTER_HOOKS);
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Cancellation: closes every open scope, recording all unreached tests as skipped.
     */
    private void drain() {
        while (!state.stack().isEmpty()) {
            ScopeFrame frame = state.stack().pop();
            skipAll(frame.remainingChildren());
            frame.skipRemainingChildren();
            if (frame.entered() && !frame.scope().isRoot()) {
                events.emit(new RunnerEvent.AfterDescribe(
                        frame.scope().title(), clock.millisSince(frame.startNanos())));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Tests
    // ---------------------------------------------------------------------

    private void runTest(TestNode test) {
        announceFile(test);
        Duration bodyTimeout = timingPolicy.forTest(test);
        state.setCurrentTest(new TestInfo(
                test.title(), test.describeChain(), bodyTimeout, test.callback(), test.filePath()));
        events.emit(new RunnerEvent.BeforeTest(test.title()));

        long startNanos = clock.nowNanos();
        List<ScopeFrame> chain = outerToInner();
        Verdict verdict = new Verdict();

        // beforeEach, outermost scope first. entered = deepest scope whose hooks all passed.
        int entered = -1;
        beforeEach:
        for (ScopeFrame frame : chain) {
            for (Hook hook : frame.scope().hooks(HookKind.BEFORE_EACH)) {
                Outcome outcome = runHook(hook, frame.scope());
                if (outcome instanceof Outcome.Cancelled) {
                    abandon(test);
                    return;
                }
                if (!(outcome instanceof Outcome.Success)) {
                    verdict.hookOutcome(HookKind.BEFORE_EACH, frame.scope(), outcome);
                    break beforeEach;
                }
            }
            entered++;
        }

        if (verdict.passing()) {
            Outcome outcome = state.await(racer.race(describe(test), test.callback(), bodyTimeout));
            if (outcome instanceof Outcome.Cancelled) {
                abandon(test);
                return;
            }
            verdict.bodyOutcome(outcome);
        }

        // afterEach from the deepest entered scope outward, whatever happened above.
        for (int i = entered; i >= 0; i--) {
            ScopeFrame frame = chain.get(i);
            for (Hook hook : frame.scope().hooks(HookKind.AFTER_EACH)) {
                Outcome outcome = runHook(hook, frame.scope());
                if (outcome instanceof Outcome.Cancelled) {
                    abandon(test);
                    return;
                }
                verdict.hookOutcome(HookKind.AFTER_EACH, frame.scope(), outcome);
            }
        }

        if (verdict.passing()) {
            String unit = "beforeTestSuccess listeners of " + describe(test);
            Outcome outcome = state.await(racer.race(unit,
                    done -> events.emitAndWaitForCompletion(new RunnerEvent.BeforeTestSuccess(test.title())),
                    Duration.ZERO));
            if (outcome instanceof Outcome.Cancelled) {
                abandon(test);
                return;
            }
            verdict.bodyOutcome(outcome);
        }

        long elapsedMs = clock.millisSince(startNanos);
        state.setCurrentTest(null);
        complete(test, verdict, elapsedMs);
    }

    private void complete(TestNode test, Verdict verdict, long elapsedMs) {
        String file = test.filePath().orElse(null);
        if (verdict.timeout != null) {
            state.results().record(TestResult.timeout(test.describeChain(), test.title(), elapsedMs,
                    verdict.timeout.timeoutMs(), verdict.error, file));
            events.emit(new RunnerEvent.TestTimeout(test.title(), elapsedMs, verdict.timeout.timeoutMs()));
        } else if (verdict.error != null) {
            state.results().record(TestResult.failure(test.describeChain(), test.title(), elapsedMs,
                    verdict.error, file));
            events.emit(new RunnerEvent.TestFail(test.title(), verdict.error, elapsedMs));
        } else {
            state.results().record(TestResult.success(test.describeChain(), test.title(), elapsedMs, file));
            events.emit(new RunnerEvent.TestSuccess(test.title(), elapsedMs));
        }
        events.emit(new RunnerEvent.AfterTest(test.title(), elapsedMs));

        if (stopOnFirstFail && !verdict.passing()) {
            state.requestStop();
        }
    }

    /** The test in flight when the run was cancelled: reported as skipped, never counted. */
    private void abandon(TestNode test) {
        state.setCurrentTest(null);
        skip(test);
    }

    private void skip(TestNode test) {
        state.results().record(TestResult.skipped(test.describeChain(), test.title(), test.filePath().orElse(null)));
        events.emit(new RunnerEvent.TestSkipped(test.title()));
    }

    private void skipAll(List<SuiteNode> nodes) {
        for (SuiteNode node : nodes) {
            if (node instanceof TestNode test) {
                skip(test);
            } else if (node instanceof DescribeNode describe) {
                skipAll(FocusFilter.select(describe));
            }
        }
    }

    /**
     * A {@code before} hook failed: every selected descendant test fails with the
     * hook's error, skipped ones stay skipped.
     */
    private void failRemainingChildren(ScopeFrame frame, HookFailureException failure) {
        int failed = failAll(frame.remainingChildren(), failure);
        frame.skipRemainingChildren();
        if (failed == 0) {
            // Nothing to attribute the error to; keep it as a hook record.
            state.results().record(TestResult.hookFailure(
                    frame.scope().scopeChain(), HookKind.BEFORE.label(), 0L, failure));
        }
    }

    private int failAll(List<SuiteNode> nodes, HookFailureException failure) {
        int failed = 0;
        for (SuiteNode node : nodes) {
            if (node.modifier() == Modifier.SKIP) {
                skipAll(List.of(node));
            } else if (node instanceof TestNode test) {
                state.results().record(TestResult.failure(
                        test.describeChain(), test.title(), 0L, failure, test.filePath().orElse(null)));
                events.emit(new RunnerEvent.TestFail(test.title(), failure, 0L));
                failed++;
            } else if (node instanceof DescribeNode describe) {
                failed += failAll(FocusFilter.select(describe), failure);
            }
        }
        if (failed > 0 && stopOnFirstFail) {
            state.requestStop();
        }
        return failed;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Outcome runHook(Hook hook, DescribeNode scope) {
        String unit = hook.kind().label() + " of " + describe(scope);
        return state.await(racer.race(unit, hook.callback(), timingPolicy.forHook(hook.kind())));
    }

    /**
     * Converts a non-successful hook outcome into the error recorded for it and
     * reports it to the observability sink. Returns {@code null} for success.
     */
    private HookFailureException hookFailure(HookKind kind, DescribeNode scope, Outcome outcome) {
        HookFailureException failure;
        if (outcome instanceof Outcome.Failure f) {
            failure = new HookFailureException(kind, scope.scopeChain(), f.error());
        } else if (outcome instanceof Outcome.Timeout t) {
            failure = new HookTimeoutException(kind, scope.scopeChain(), t.timeoutMs(), t.elapsedMs());
        } else {
            return null;
        }
        observabilitySink.onHookFailure(new HookFailureEvent(wallClock.now(), kind, scope.scopeChain(), failure));
        return failure;
    }

    private ScopeFrame newFrame(DescribeNode scope) {
        return new ScopeFrame(scope, FocusFilter.select(scope), clock.nowNanos());
    }

    private List<ScopeFrame> outerToInner() {
        List<ScopeFrame> chain = new ArrayList<>(state.stack().size());
        Iterator<ScopeFrame> it = state.stack().descendingIterator();
        while (it.hasNext()) {
            chain.add(it.next());
        }
        return chain;
    }

    private void announceFile(SuiteNode node) {
        node.filePath().ifPresent(path -> {
            if (state.switchFile(path)) {
                events.emit(new RunnerEvent.ActiveFileChanged(path));
            }
        });
    }

    private static String describe(SuiteNode node) {
        return node.toString();
    }

    /**
     * Outcome of one test's sandwich. The first failure or timeout is primary;
     * later errors are attached to it so each appears in exactly one record.
     */
    private final class Verdict {
        private Throwable error;
        private Outcome.Timeout timeout;

        boolean passing() {
            return error == null && timeout == null;
        }

        /** Only called while still passing. */
        void bodyOutcome(Outcome outcome) {
            if (outcome instanceof Outcome.Failure f) {
                addError(f.error());
            } else if (outcome instanceof Outcome.Timeout t) {
                timeout = t;
            }
        }

        void hookOutcome(HookKind kind, DescribeNode scope, Outcome outcome) {
            HookFailureException failure = hookFailure(kind, scope, outcome);
            if (failure == null) {
                return;
            }
            if (outcome instanceof Outcome.Timeout t && passing()) {
                timeout = t;
            } else {
                addError(failure);
            }
        }

        private void addError(Throwable next) {
            if (error == null) {
                error = next;
            } else if (error != next) {
                error.addSuppressed(next);
            }
        }
    }
}
