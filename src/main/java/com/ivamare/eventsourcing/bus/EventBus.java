package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Publish/subscribe for recorded events.
 */
public interface EventBus {

    /**
     * Deliver events to every matching subscriber.
     *
     * @return completes once every matching handler invocation has been attempted; handler
     *         failures are reported through {@link #errors} and do not fail the future
     */
    CompletableFuture<Void> publish(List<? extends Event> events);

    /**
     * Subscribe a handler. Subscribing the same instance again returns the existing
     * subscription.
     */
    Subscription subscribe(EventHandler handler);

    /**
     * Listen to the error channel.
     */
    Subscription errors(Consumer<EventHandlingError> listener);

    /**
     * Report an error on the error channel.
     */
    void publishError(EventHandlingError error);
}
