package com.questrail.runner.api;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Callback
 * =============================================================================
 * Normalised form of every hook and test body the runner executes.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A non-null returned stage is raced against the {@link Done} signal;
 *       whichever settles first decides the outcome.</li>
 *   <li>A {@code null} return means the unit completes only through
 *       {@link Done}.</li>
 *   <li>A synchronously thrown {@link Throwable} is a failure.</li>
 * </ul>
 *
 * The three user-facing shapes ({@link Block}, {@link AsyncBlock},
 * {@link DoneBlock}) are adapted through the static factories below.
 */
@FunctionalInterface
public interface Callback
{
    CompletionStage<?> invoke(Done done) throws Throwable;

    static Callback fromBlock(Block block)
    {
        Objects.requireNonNull(block, "block");
        return done -> {
            block.run();
            return CompletableFuture.completedFuture(null);
        };
    }

    static Callback fromAsync(AsyncBlock block)
    {
        Objects.requireNonNull(block, "block");
        return done -> {
            CompletionStage<?> stage = block.run();
            return stage != null ? stage : CompletableFuture.completedFuture(null);
        };
    }

    static Callback fromDone(DoneBlock block)
    {
        Objects.requireNonNull(block, "block");
        return done -> {
            block.run(done);
            return null;
        };
    }
}
