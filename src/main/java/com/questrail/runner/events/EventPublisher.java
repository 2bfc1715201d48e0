package com.questrail.runner.events;

import java.util.concurrent.CompletableFuture;

/**
 * The publish side of the event facility; the only part the execution engine
 * depends on.
 */
public interface EventPublisher<E>
{
    /**
     * Invokes every matching listener synchronously. A listener exception
     * propagates to the caller.
     */
    void emit(E event);

    /**
     * Like {@link #emit(Object)}, and additionally waits for every stage returned
     * by an asynchronous listener. The returned future fails if any of those
     * stages fails.
     */
    CompletableFuture<Void> emitAndWaitForCompletion(E event);
}
