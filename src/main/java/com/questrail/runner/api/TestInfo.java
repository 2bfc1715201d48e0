package com.questrail.runner.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The test currently being evaluated, as returned by
 * {@link TestRunner#getCurrentTestInfo()}.
 *
 * @param timeout resolved body timeout ({@link Duration#ZERO} means none)
 */
public record TestInfo(
    String title,
    List<String> describeChain,
    Duration timeout,
    Callback callback,
    Optional<String> filePath
) {
    public TestInfo {
        Objects.requireNonNull(title, "title");
        describeChain = List.copyOf(describeChain);
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(filePath, "filePath");
    }
}
