package com.questrail.runner.api;

/**
 * Body of a describe block. Runs synchronously at registration time and
 * registers nested describes, tests and hooks.
 */
@FunctionalInterface
public interface DescribeBody
{
    void define() throws Exception;
}
