package com.ivamare.eventsourcing.bus;

/**
 * Handle returned by subscriptions; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
