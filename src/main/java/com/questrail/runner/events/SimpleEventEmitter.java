package com.questrail.runner.events;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * SimpleEventEmitter
 * =============================================================================
 * Minimal typed publish/subscribe utility keyed by event class.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Listeners run synchronously on the emitting thread, in registration order.</li>
 *   <li>Exceptions are not swallowed: a throwing listener aborts the emit and the
 *       exception reaches the caller. Listener authors own their error handling.</li>
 *   <li>{@code once} listeners are removed before they are invoked.</li>
 *   <li>{@code off} removes a listener by the same reference passed to {@code on},
 *       {@code onAsync} or {@code once}.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Registration and emission may happen on different threads. Each emit works on
 * a snapshot of the listeners registered when it started.
 */
public final class SimpleEventEmitter<E> implements EventPublisher<E>
{
    private final Map<Class<?>, CopyOnWriteArrayList<Registration<E>>> listeners = new ConcurrentHashMap<>();

    /**
     * Registers a listener for every event of the given type.
     */
    public <T extends E> void on(Class<T> type, Consumer<? super T> listener)
    {
        Objects.requireNonNull(listener, "listener");
        register(type, listener, event -> {
            listener.accept(type.cast(event));
            return null;
        }, false);
    }

    /**
     * Registers a listener whose returned stage is awaited by
     * {@link #emitAndWaitForCompletion(Object)}. Plain {@link #emit(Object)} ignores it.
     */
    public <T extends E> void onAsync(Class<T> type, Function<? super T, ? extends CompletionStage<?>> listener)
    {
        Objects.requireNonNull(listener, "listener");
        register(type, listener, event -> listener.apply(type.cast(event)), false);
    }

    /**
     * Registers a listener invoked for the next event of the given type only.
     */
    public <T extends E> void once(Class<T> type, Consumer<? super T> listener)
    {
        Objects.requireNonNull(listener, "listener");
        register(type, listener, event -> {
            listener.accept(type.cast(event));
            return null;
        }, true);
    }

    /**
     * Removes every registration of {@code listener} for the given type.
     */
    public <T extends E> void off(Class<T> type, Object listener)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        List<Registration<E>> registered = listeners.get(type);
        if (registered != null) {
            registered.removeIf(r -> r.listener == listener);
        }
    }

    /** Removes every listener. */
    public void clear()
    {
        listeners.clear();
    }

    /** Number of listeners currently registered for the type. */
    public int listenerCount(Class<? extends E> type)
    {
        List<Registration<E>> registered = listeners.get(type);
        return registered == null ? 0 : registered.size();
    }

    @Override
    public void emit(E event)
    {
        dispatch(event);
    }

    @Override
    public CompletableFuture<Void> emitAndWaitForCompletion(E event)
    {
        List<CompletionStage<?>> pending = dispatch(event);
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] futures = pending.stream()
                .map(CompletionStage::toCompletableFuture)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }

    private void register(Class<?> type, Object listener, Function<E, CompletionStage<?>> invoker, boolean once)
    {
        Objects.requireNonNull(type, "type");
        listeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
                .add(new Registration<>(listener, invoker, once));
    }

    private List<CompletionStage<?>> dispatch(E event)
    {
        Objects.requireNonNull(event, "event");
        CopyOnWriteArrayList<Registration<E>> registered = listeners.get(event.getClass());
        if (registered == null || registered.isEmpty()) {
            return List.of();
        }

        List<CompletionStage<?>> pending = new ArrayList<>();
        for (Registration<E> registration : List.copyOf(registered)) {
            if (registration.once && !registered.remove(registration)) {
                // Another emit already consumed this once-listener.
                continue;
            }
            CompletionStage<?> stage = registration.invoker.apply(event);
            if (stage != null) {
                pending.add(stage);
            }
        }
        return pending;
    }

    private static final class Registration<E>
    {
        private final Object listener;
        private final Function<E, CompletionStage<?>> invoker;
        private final boolean once;

        private Registration(Object listener, Function<E, CompletionStage<?>> invoker, boolean once)
        {
            this.listener = listener;
            this.invoker = invoker;
            this.once = once;
        }
    }
}
