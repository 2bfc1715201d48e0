package com.questrail.runner.api;

/**
 * Done
 * -----------------------------------------------------------------------------
 * Explicit completion signal handed to a {@link DoneBlock} or raw {@link Callback}.
 *
 * <p>Only the first signal is honoured. Signalling after the unit has already
 * settled (including after it timed out) has no effect.</p>
 */
public interface Done
{
    /** Marks the unit as successfully completed. */
    void complete();

    /** Marks the unit as failed with the given error. */
    void fail(Throwable error);
}
