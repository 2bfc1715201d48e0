package com.questrail.runner.api;

/**
 * Synchronous hook or test body. Completes when {@link #run()} returns;
 * anything it throws is recorded as the failure.
 */
@FunctionalInterface
public interface Block
{
    void run() throws Exception;
}
