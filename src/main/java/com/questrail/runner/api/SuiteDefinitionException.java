package com.questrail.runner.api;

/**
 * Wraps a checked exception thrown by a {@link DescribeBody} while the suite
 * tree is being registered.
 */
public class SuiteDefinitionException extends RuntimeException
{
    public SuiteDefinitionException(String describeTitle, Throwable cause)
    {
        super("Failed to define describe block '" + describeTitle + "'", cause);
    }
}
