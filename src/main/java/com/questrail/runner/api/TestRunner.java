package com.questrail.runner.api;

import com.questrail.runner.config.TestRunnerConfig;
import com.questrail.runner.events.RunnerEvent;
import com.questrail.runner.events.SimpleEventEmitter;
import com.questrail.runner.internal.exec.QueueStackScheduler;
import com.questrail.runner.internal.exec.RunState;
import com.questrail.runner.internal.exec.TimeoutRacer;
import com.questrail.runner.internal.exec.TimingPolicy;
import com.questrail.runner.internal.time.MonotonicClock;
import com.questrail.runner.internal.time.MonotonicScheduler;
import com.questrail.runner.internal.time.ScheduledExecutorScheduler;
import com.questrail.runner.internal.time.SystemMonotonicClock;
import com.questrail.runner.internal.time.SystemWallClock;
import com.questrail.runner.internal.time.WallClock;
import com.questrail.runner.model.DescribeNode;
import com.questrail.runner.model.FocusFilter;
import com.questrail.runner.model.Hook;
import com.questrail.runner.model.HookKind;
import com.questrail.runner.model.Modifier;
import com.questrail.runner.model.TestNode;
import com.questrail.runner.observability.RunFinishedEvent;
import com.questrail.runner.observability.RunStartedEvent;
import com.questrail.runner.observability.RunnerErrorEvent;
import com.questrail.runner.observability.RunnerObservabilitySink;
import com.questrail.runner.observability.Slf4jRunnerObservabilitySink;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * TestRunner
 * =============================================================================
 * Registration and lifecycle façade of the test-execution engine.
 *
 * <h2>Registration</h2>
 * {@code describe} bodies run immediately and register nested describes, tests
 * and hooks into the currently open scope. Tests and hooks registered outside
 * any describe attach to an implicit root scope. Test bodies are deferred until
 * {@link #run()}.
 *
 * <h2>Execution order</h2>
 * <pre>
 *   before → (beforeEach outer..inner → it → afterEach inner..outer)* → after
 * </pre>
 * Every hook and test body is raced against its timeout; see
 * {@link TimingPolicy} for how the timeout is chosen.
 *
 * <h2>Lifecycle rules</h2>
 * <ul>
 *   <li>One run at a time: {@link #run()} during a run throws {@link UsageException}.</li>
 *   <li>{@link #reset()} and every registration method throw while a run is active.</li>
 *   <li>{@link #cancel()} stops the run between units of work, aborts the unit in
 *       flight and completes with the partial results.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * A run executes on its own thread, one unit of work at a time. Registration is
 * serialized on an internal monitor.
 */
public final class TestRunner implements AutoCloseable
{
    private final TestRunnerConfig config;
    private final TimingPolicy timingPolicy;
    private final SimpleEventEmitter<RunnerEvent> eventEmitter;
    private final RunnerObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedTimerExecutor;

    private final Object monitor = new Object();
    private final Deque<DescribeNode> openScopes = new ArrayDeque<>();
    private DescribeNode root = DescribeNode.root();
    private String currentFile;

    private volatile ActiveRun activeRun;
    private volatile RunResults lastResults = RunResults.empty();

    public TestRunner()
    {
        this(TestRunnerConfig.defaults());
    }

    public TestRunner(TestRunnerConfig config)
    {
        this(builder().withConfig(config));
    }

    public TestRunner(TestRunnerConfig config, SimpleEventEmitter<RunnerEvent> eventEmitter)
    {
        this(builder().withConfig(config).withEventEmitter(eventEmitter));
    }

    private TestRunner(Builder builder)
    {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.timingPolicy = new TimingPolicy(config.timeouts());
        this.eventEmitter = Objects.requireNonNull(builder.eventEmitter, "eventEmitter");
        this.observabilitySink = Objects.requireNonNull(builder.observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.wallClock = Objects.requireNonNull(builder.wallClock, "wallClock");
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownedTimerExecutor = null;
        } else {
            this.ownedTimerExecutor = ScheduledExecutorScheduler.newTimerExecutor();
            this.scheduler = new ScheduledExecutorScheduler(ownedTimerExecutor, clock);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public TestRunnerConfig config()
    {
        return config;
    }

    /** The emitter lifecycle events are published to. */
    public SimpleEventEmitter<RunnerEvent> events()
    {
        return eventEmitter;
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    public <T extends RunnerEvent> void on(Class<T> type, Consumer<? super T> listener)
    {
        eventEmitter.on(type, listener);
    }

    public <T extends RunnerEvent> void onAsync(Class<T> type, Function<? super T, ? extends CompletionStage<?>> listener)
    {
        eventEmitter.onAsync(type, listener);
    }

    public <T extends RunnerEvent> void once(Class<T> type, Consumer<? super T> listener)
    {
        eventEmitter.once(type, listener);
    }

    public <T extends RunnerEvent> void off(Class<T> type, Object listener)
    {
        eventEmitter.off(type, listener);
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    /**
     * Tags every subsequently registered describe and test with the given source path.
     */
    public void setCurrentFile(String absolutePath)
    {
        synchronized (monitor) {
            this.currentFile = Objects.requireNonNull(absolutePath, "absolutePath");
        }
    }

    public void describe(String title, DescribeBody body)
    {
        registerDescribe(title, body, Modifier.NONE);
    }

    public void describeOnly(String title, DescribeBody body)
    {
        registerDescribe(title, body, Modifier.ONLY);
    }

    public void describeSkip(String title, DescribeBody body)
    {
        registerDescribe(title, body, Modifier.SKIP);
    }

    public void it(String title, Block body)
    {
        registerTest(title, Callback.fromBlock(body), null, Modifier.NONE);
    }

    public void it(String title, AsyncBlock body)
    {
        registerTest(title, Callback.fromAsync(body), null, Modifier.NONE);
    }

    public void it(String title, DoneBlock body)
    {
        registerTest(title, Callback.fromDone(body), null, Modifier.NONE);
    }

    public void it(String title, Block body, ItOptions options)
    {
        registerTest(title, Callback.fromBlock(body), options, Modifier.NONE);
    }

    public void it(String title, AsyncBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromAsync(body), options, Modifier.NONE);
    }

    public void it(String title, DoneBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromDone(body), options, Modifier.NONE);
    }

    public void itOnly(String title, Block body)
    {
        registerTest(title, Callback.fromBlock(body), null, Modifier.ONLY);
    }

    public void itOnly(String title, AsyncBlock body)
    {
        registerTest(title, Callback.fromAsync(body), null, Modifier.ONLY);
    }

    public void itOnly(String title, DoneBlock body)
    {
        registerTest(title, Callback.fromDone(body), null, Modifier.ONLY);
    }

    public void itOnly(String title, Block body, ItOptions options)
    {
        registerTest(title, Callback.fromBlock(body), options, Modifier.ONLY);
    }

    public void itOnly(String title, AsyncBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromAsync(body), options, Modifier.ONLY);
    }

    public void itOnly(String title, DoneBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromDone(body), options, Modifier.ONLY);
    }

    public void itSkip(String title, Block body)
    {
        registerTest(title, Callback.fromBlock(body), null, Modifier.SKIP);
    }

    public void itSkip(String title, AsyncBlock body)
    {
        registerTest(title, Callback.fromAsync(body), null, Modifier.SKIP);
    }

    public void itSkip(String title, DoneBlock body)
    {
        registerTest(title, Callback.fromDone(body), null, Modifier.SKIP);
    }

    public void itSkip(String title, Block body, ItOptions options)
    {
        registerTest(title, Callback.fromBlock(body), options, Modifier.SKIP);
    }

    public void itSkip(String title, AsyncBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromAsync(body), options, Modifier.SKIP);
    }

    public void itSkip(String title, DoneBlock body, ItOptions options)
    {
        registerTest(title, Callback.fromDone(body), options, Modifier.SKIP);
    }

    public void before(Block body)
    {
        registerHook(HookKind.BEFORE, Callback.fromBlock(body));
    }

    public void before(AsyncBlock body)
    {
        registerHook(HookKind.BEFORE, Callback.fromAsync(body));
    }

    public void before(DoneBlock body)
    {
        registerHook(HookKind.BEFORE, Callback.fromDone(body));
    }

    public void beforeEach(Block body)
    {
        registerHook(HookKind.BEFORE_EACH, Callback.fromBlock(body));
    }

    public void beforeEach(AsyncBlock body)
    {
        registerHook(HookKind.BEFORE_EACH, Callback.fromAsync(body));
    }

    public void beforeEach(DoneBlock body)
    {
        registerHook(HookKind.BEFORE_EACH, Callback.fromDone(body));
    }

    public void after(Block body)
    {
        registerHook(HookKind.AFTER, Callback.fromBlock(body));
    }

    public void after(AsyncBlock body)
    {
        registerHook(HookKind.AFTER, Callback.fromAsync(body));
    }

    public void after(DoneBlock body)
    {
        registerHook(HookKind.AFTER, Callback.fromDone(body));
    }

    public void afterEach(Block body)
    {
        registerHook(HookKind.AFTER_EACH, Callback.fromBlock(body));
    }

    public void afterEach(AsyncBlock body)
    {
        registerHook(HookKind.AFTER_EACH, Callback.fromAsync(body));
    }

    public void afterEach(DoneBlock body)
    {
        registerHook(HookKind.AFTER_EACH, Callback.fromDone(body));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts a run over everything registered so far.
     *
     * @return completes with the results once every scope has been closed, or
     *         exceptionally if an event listener aborted the run
     * @throws UsageException if a run is already active
     */
    public CompletableFuture<RunResults> run()
    {
        ActiveRun run;
        synchronized (monitor) {
            if (activeRun != null) {
                throw new UsageException("A test run is already in progress");
            }
            RunState state = new RunState(clock.nowNanos());
            QueueStackScheduler queueStack = new QueueStackScheduler(
                    root,
                    state,
                    timingPolicy,
                    config.stopOnFirstFail(),
                    new TimeoutRacer(clock, scheduler, wallClock, observabilitySink),
                    eventEmitter,
                    clock,
                    wallClock,
                    observabilitySink);
            run = new ActiveRun(state, queueStack, FocusFilter.selectedTests(root).size());
            activeRun = run;
        }

        Thread thread = new Thread(() -> execute(run), "questrail-test-runner");
        thread.start();
        return run.future;
    }

    /**
     * Cancels the active run.
     *
     * @return the active run's future, which completes with the results gathered
     *         so far; when idle, the results of the last run
     */
    public CompletableFuture<RunResults> cancel()
    {
        ActiveRun run = activeRun;
        if (run == null) {
            return CompletableFuture.completedFuture(lastResults);
        }
        run.state.cancel();
        return run.future;
    }

    /**
     * Information on the test in progress, including while its hooks run.
     *
     * @throws UsageException if no test is in progress
     */
    public TestInfo getCurrentTestInfo()
    {
        ActiveRun run = activeRun;
        if (run == null) {
            throw new UsageException("No test run is in progress");
        }
        return run.state.currentTest()
                .orElseThrow(() -> new UsageException("No test is currently being evaluated"));
    }

    /**
     * Discards every registered describe, test and hook, the current file and the
     * last results.
     *
     * @throws UsageException if a run is active or a describe body is being registered
     */
    public void reset()
    {
        synchronized (monitor) {
            throwIfRunActive("reset");
            if (!openScopes.isEmpty()) {
                throw new UsageException("Cannot call reset() inside a describe body");
            }
            root = DescribeNode.root();
            openScopes.clear();
            currentFile = null;
            lastResults = RunResults.empty();
        }
    }

    public boolean isRunning()
    {
        return activeRun != null;
    }

    /**
     * Releases the timer thread this runner created, if any. Cancels an active run.
     */
    @Override
    public void close()
    {
        cancel();
        if (ownedTimerExecutor != null) {
            ownedTimerExecutor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void execute(ActiveRun run)
    {
        RunState state = run.state;
        observabilitySink.onRunStarted(new RunStartedEvent(wallClock.now(), run.selectedTests));
        try {
            run.queueStack.execute();
            RunResults results = state.results().snapshot(clock.millisSince(state.startNanos()));
            observabilitySink.onRunFinished(new RunFinishedEvent(wallClock.now(), results, state.isCancelledByCaller()));
            finish(run, results);
            run.future.complete(results);
        } catch (Throwable t) {
            observabilitySink.onError(new RunnerErrorEvent(wallClock.now(), "Test run aborted", t));
            finish(run, state.results().snapshot(clock.millisSince(state.startNanos())));
            run.future.completeExceptionally(t);
        }
    }

    private void finish(ActiveRun run, RunResults results)
    {
        synchronized (monitor) {
            lastResults = results;
            if (activeRun == run) {
                activeRun = null;
            }
        }
    }

    private void registerDescribe(String title, DescribeBody body, Modifier modifier)
    {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        synchronized (monitor) {
            throwIfRunActive("describe");
            DescribeNode node = currentScope().addDescribe(title, modifier, currentFile);
            openScopes.push(node);
            try {
                body.define();
            } catch (RuntimeException | Error e) {
                throw e;
            } catch (Exception e) {
                throw new SuiteDefinitionException(title, e);
            } finally {
                openScopes.pop();
            }
        }
    }

    private void registerTest(String title, Callback callback, ItOptions options, Modifier modifier)
    {
        Objects.requireNonNull(title, "title");
        Duration timeout = options == null ? null : options.timeout();
        synchronized (monitor) {
            throwIfRunActive("it");
            currentScope().addTest(new TestNode.Definition(title, callback, timeout, modifier, currentFile));
        }
    }

    private void registerHook(HookKind kind, Callback callback)
    {
        synchronized (monitor) {
            throwIfRunActive(kind.id());
            currentScope().addHook(new Hook(kind, callback));
        }
    }

    private DescribeNode currentScope()
    {
        DescribeNode open = openScopes.peek();
        return open != null ? open : root;
    }

    private void throwIfRunActive(String operation)
    {
        if (activeRun != null) {
            throw new UsageException("Cannot call " + operation + "() while a test run is in progress");
        }
    }

    private static final class ActiveRun
    {
        private final RunState state;
        private final QueueStackScheduler queueStack;
        private final int selectedTests;
        private final CompletableFuture<RunResults> future = new CompletableFuture<>();

        private ActiveRun(RunState state, QueueStackScheduler queueStack, int selectedTests)
        {
            this.state = state;
            this.queueStack = queueStack;
            this.selectedTests = selectedTests;
        }
    }

    public static final class Builder
    {
        private TestRunnerConfig config = TestRunnerConfig.defaults();
        private SimpleEventEmitter<RunnerEvent> eventEmitter = new SimpleEventEmitter<>();
        private RunnerObservabilitySink observabilitySink = new Slf4jRunnerObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(TestRunnerConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withEventEmitter(SimpleEventEmitter<RunnerEvent> eventEmitter)
        {
            this.eventEmitter = eventEmitter;
            return this;
        }

        public Builder withObservabilitySink(RunnerObservabilitySink observabilitySink)
        {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for timeout timers. When not set, the runner creates and owns
         * a daemon timer thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public TestRunner build()
        {
            return new TestRunner(this);
        }
    }
}
