package com.questrail.runner.api;

/**
 * Raised when the runner is used out of order: a second {@code run()} while one
 * is active, {@code reset()} or registration during a run, or
 * {@code getCurrentTestInfo()} with no test in progress.
 *
 * <p>The offending call fails; the runner's state is left untouched.</p>
 */
public class UsageException extends IllegalStateException
{
    public UsageException(String message)
    {
        super(message);
    }
}
