package com.questrail.runner.api;

/**
 * Outcome kind of one result record.
 */
public enum TestStatus
{
    SUCCESS,
    FAILURE,
    TIMEOUT,
    /** Not executed; never part of the run totals. */
    SKIPPED
}
