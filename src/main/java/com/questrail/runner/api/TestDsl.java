package com.questrail.runner.api;

import com.questrail.runner.config.RunnerProperties;

import java.util.Objects;

/**
 * TestDsl
 * =============================================================================
 * Static entry points over one shared {@link TestRunner}, so suites can be
 * written as {@code describe("x", () -> it("y", () -> ...))} after a static import.
 *
 * <p>The shared runner is created on first use from {@link RunnerProperties#load()}
 * unless one was {@linkplain #install(TestRunner) installed} first.</p>
 */
public final class TestDsl
{
    private static final Object LOCK = new Object();
    private static volatile TestRunner runner;

    private TestDsl() {}

    /**
     * The shared runner, creating it from properties on first use.
     */
    public static TestRunner runner()
    {
        TestRunner current = runner;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (runner == null) {
                runner = new TestRunner(RunnerProperties.load());
            }
            return runner;
        }
    }

    /**
     * Replaces the shared runner. The previous one is returned, not closed.
     */
    public static TestRunner install(TestRunner replacement)
    {
        Objects.requireNonNull(replacement, "replacement");
        synchronized (LOCK) {
            TestRunner previous = runner;
            runner = replacement;
            return previous;
        }
    }

    public static void describe(String title, DescribeBody body)
    {
        runner().describe(title, body);
    }

    public static void describeOnly(String title, DescribeBody body)
    {
        runner().describeOnly(title, body);
    }

    public static void describeSkip(String title, DescribeBody body)
    {
        runner().describeSkip(title, body);
    }

    public static void it(String title, Block body)
    {
        runner().it(title, body);
    }

    public static void it(String title, AsyncBlock body)
    {
        runner().it(title, body);
    }

    public static void it(String title, DoneBlock body)
    {
        runner().it(title, body);
    }

    public static void it(String title, Block body, ItOptions options)
    {
        runner().it(title, body, options);
    }

    public static void it(String title, AsyncBlock body, ItOptions options)
    {
        runner().it(title, body, options);
    }

    public static void it(String title, DoneBlock body, ItOptions options)
    {
        runner().it(title, body, options);
    }

    public static void itOnly(String title, Block body)
    {
        runner().itOnly(title, body);
    }

    public static void itOnly(String title, AsyncBlock body)
    {
        runner().itOnly(title, body);
    }

    public static void itOnly(String title, DoneBlock body)
    {
        runner().itOnly(title, body);
    }

    public static void itSkip(String title, Block body)
    {
        runner().itSkip(title, body);
    }

    public static void itSkip(String title, AsyncBlock body)
    {
        runner().itSkip(title, body);
    }

    public static void itSkip(String title, DoneBlock body)
    {
        runner().itSkip(title, body);
    }

    public static void itOnly(String title, Block body, ItOptions options)
    {
        runner().itOnly(title, body, options);
    }

    public static void itOnly(String title, AsyncBlock body, ItOptions options)
    {
        runner().itOnly(title, body, options);
    }

    public static void itOnly(String title, DoneBlock body, ItOptions options)
    {
        runner().itOnly(title, body, options);
    }

    public static void itSkip(String title, Block body, ItOptions options)
    {
        runner().itSkip(title, body, options);
    }

    public static void itSkip(String title, AsyncBlock body, ItOptions options)
    {
        runner().itSkip(title, body, options);
    }

    public static void itSkip(String title, DoneBlock body, ItOptions options)
    {
        runner().itSkip(title, body, options);
    }

    public static void before(Block body)
    {
        runner().before(body);
    }

    public static void before(AsyncBlock body)
    {
        runner().before(body);
    }

    public static void before(DoneBlock body)
    {
        runner().before(body);
    }

    public static void beforeEach(Block body)
    {
        runner().beforeEach(body);
    }

    public static void beforeEach(AsyncBlock body)
    {
        runner().beforeEach(body);
    }

    public static void beforeEach(DoneBlock body)
    {
        runner().beforeEach(body);
    }

    public static void after(Block body)
    {
        runner().after(body);
    }

    public static void after(AsyncBlock body)
    {
        runner().after(body);
    }

    public static void after(DoneBlock body)
    {
        runner().after(body);
    }

    public static void afterEach(Block body)
    {
        runner().afterEach(body);
    }

    public static void afterEach(AsyncBlock body)
    {
        runner().afterEach(body);
    }

    public static void afterEach(DoneBlock body)
    {
        runner().afterEach(body);
    }
}
