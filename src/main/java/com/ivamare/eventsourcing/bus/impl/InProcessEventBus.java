package com.ivamare.eventsourcing.bus.impl;

import com.ivamare.eventsourcing.bus.EventBus;
import com.ivamare.eventsourcing.bus.EventHandler;
import com.ivamare.eventsourcing.bus.EventHandlerBinding;
import com.ivamare.eventsourcing.bus.EventHandlerRegistry;
import com.ivamare.eventsourcing.bus.EventHandlingDeserializationError;
import com.ivamare.eventsourcing.bus.EventHandlingError;
import com.ivamare.eventsourcing.bus.Subscription;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.serialization.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Event bus that dispatches on a fixed worker pool inside the process.
 *
 * <p>Each subscriber receives a published batch in order on one worker; subscribers run in
 * parallel. A failing invocation is caught, logged and published as an
 * {@link EventHandlingError}; it never reaches the publisher or other handlers.
 *
 * <p>Publishing from inside a handler (a consequenter that saves an aggregate) dispatches on
 * the calling worker, so nested publishes cannot exhaust the pool.
 */
public class InProcessEventBus implements EventBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InProcessEventBus.class);

    private static final ThreadLocal<Boolean> DISPATCHING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final EventSerializer serializer;
    private final EventHandlerRegistry registry;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final Map<EventHandler, HandlerSubscription> subscriptions = new ConcurrentHashMap<>();
    private final List<Consumer<EventHandlingError>> errorListeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a bus with its own pool of {@code handlerThreads} daemon threads.
     */
    public InProcessEventBus(EventSerializer serializer, EventHandlerRegistry registry, int handlerThreads) {
        this(serializer, registry, Executors.newFixedThreadPool(handlerThreads, new DispatchThreadFactory()), true);
    }

    /**
     * Creates a bus on a caller-managed executor.
     */
    public InProcessEventBus(EventSerializer serializer, EventHandlerRegistry registry, ExecutorService executor) {
        this(serializer, registry, executor, false);
    }

    private InProcessEventBus(EventSerializer serializer, EventHandlerRegistry registry,
                              ExecutorService executor, boolean ownsExecutor) {
        this.serializer = serializer;
        this.registry = registry;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public CompletableFuture<Void> publish(List<? extends Event> events) {
        if (events.isEmpty() || subscriptions.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<HandlerSubscription> targets = new ArrayList<>(subscriptions.values());
        log.debug("Publishing {} events to {} subscribers", events.size(), targets.size());

        if (DISPATCHING.get()) {
            targets.forEach(subscription -> deliver(subscription, events));
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?>[] futures = targets.stream()
            .map(subscription -> CompletableFuture.runAsync(() -> {
                DISPATCHING.set(Boolean.TRUE);
                try {
                    deliver(subscription, events);
                } finally {
                    DISPATCHING.set(Boolean.FALSE);
                }
            }, executor))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }

    private void deliver(HandlerSubscription subscription, List<? extends Event> events) {
        for (Event event : events) {
            for (EventHandlerBinding binding : subscription.bindings()) {
                if (!binding.matches(event)) {
                    continue;
                }
                try {
                    binding.dispatch(event, serializer);
                } catch (EventSerializationException e) {
                    log.warn("Handler {} could not read {}: {}", subscription.name(), event, e.getMessage());
                    publishError(EventHandlingDeserializationError.of(
                        e, subscription.name(), event, serializer.serializeBody(event)));
                } catch (Exception e) {
                    log.warn("Handler {} failed on {}: {}", subscription.name(), event, e.getMessage());
                    publishError(new EventHandlingError(e, subscription.name(), event));
                }
            }
        }
    }

    @Override
    public Subscription subscribe(EventHandler handler) {
        subscriptions.computeIfAbsent(handler, h -> {
            log.info("Subscribed {}", h.handlerName());
            return new HandlerSubscription(h.handlerName(), registry.bindingsFor(h));
        });
        return () -> {
            if (subscriptions.remove(handler) != null) {
                log.info("Unsubscribed {}", handler.handlerName());
            }
        };
    }

    @Override
    public Subscription errors(Consumer<EventHandlingError> listener) {
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    @Override
    public void publishError(EventHandlingError error) {
        for (Consumer<EventHandlingError> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (RuntimeException e) {
                log.error("Error listener failed while reporting {}", error, e);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record HandlerSubscription(String name, List<EventHandlerBinding> bindings) {
    }

    private static final class DispatchThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "event-bus-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
