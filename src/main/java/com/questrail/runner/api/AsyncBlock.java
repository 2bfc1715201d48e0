package com.questrail.runner.api;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous hook or test body. Completes when the returned stage settles.
 * A {@code null} return is treated as an already successful stage.
 */
@FunctionalInterface
public interface AsyncBlock
{
    CompletionStage<?> run() throws Exception;
}
