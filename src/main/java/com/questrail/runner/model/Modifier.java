package com.questrail.runner.model;

/**
 * Registration-time modifier of a describe or test.
 */
public enum Modifier
{
    NONE,
    /** Narrows the run to this node and other {@code ONLY} nodes. */
    ONLY,
    /** Excludes the node from execution; its tests are reported as skipped. */
    SKIP
}
