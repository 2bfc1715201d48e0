package com.questrail.runner.api;

/**
 * Hook or test body that signals its own completion through {@link Done}.
 * Returning from {@link #run(Done)} does not complete the unit.
 */
@FunctionalInterface
public interface DoneBlock
{
    void run(Done done) throws Exception;
}
