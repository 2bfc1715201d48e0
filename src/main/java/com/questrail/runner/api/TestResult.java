package com.questrail.runner.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TestResult
 * -----------------------------------------------------------------------------
 * One entry of {@link RunResults}. Titles are not unique; a test is located by
 * its describe chain plus title.
 *
 * @param describeChain titles of the enclosing describes, outermost first
 * @param title         test title, or the hook label for {@link Source#HOOK} records
 * @param status        outcome kind
 * @param elapsedMs     time spent on the test including its beforeEach/afterEach hooks
 * @param error         failure cause; for a timeout, a cleanup error raised after it; else {@code null}
 * @param timeoutMs     configured timeout of the unit that timed out, {@code 0} unless {@code TIMEOUT}
 * @param filePath      source file active when the test was registered, or {@code null}
 * @param source        whether the record stands for a test or for a scope-level hook
 */
public record TestResult(
    List<String> describeChain,
    String title,
    TestStatus status,
    long elapsedMs,
    Throwable error,
    long timeoutMs,
    String filePath,
    Source source
) {
    /** What a result record stands for. */
    public enum Source { TEST, HOOK }

    public TestResult {
        describeChain = List.copyOf(Objects.requireNonNull(describeChain, "describeChain"));
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(source, "source");
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative");
        }
        if (status == TestStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("a failure record needs its error");
        }
    }

    public static TestResult success(List<String> chain, String title, long elapsedMs, String filePath) {
        return new TestResult(chain, title, TestStatus.SUCCESS, elapsedMs, null, 0L, filePath, Source.TEST);
    }

    public static TestResult failure(List<String> chain, String title, long elapsedMs, Throwable error, String filePath) {
        return new TestResult(chain, title, TestStatus.FAILURE, elapsedMs, error, 0L, filePath, Source.TEST);
    }

    public static TestResult timeout(List<String> chain, String title, long elapsedMs, long timeoutMs,
                                     Throwable cleanupError, String filePath) {
        return new TestResult(chain, title, TestStatus.TIMEOUT, elapsedMs, cleanupError, timeoutMs, filePath, Source.TEST);
    }

    public static TestResult skipped(List<String> chain, String title, String filePath) {
        return new TestResult(chain, title, TestStatus.SKIPPED, 0L, null, 0L, filePath, Source.TEST);
    }

    public static TestResult hookFailure(List<String> chain, String hookLabel, long elapsedMs, Throwable error) {
        return new TestResult(chain, hookLabel, TestStatus.FAILURE, elapsedMs, error, 0L, null, Source.HOOK);
    }

    public Optional<Throwable> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
