package com.ivamare.eventsourcing.bus;

/**
 * Subscriber to the event bus. Declares what it reacts to through an {@link EventHandlerBinder}
 * when subscribed.
 *
 * <pre>
 * public void bind(EventHandlerBinder binder) {
 *     binder.on(ItemAdded.class, this::updateTotals)
 *           .onAny("Order", "*", e -&gt; audit.add(e));
 * }
 * </pre>
 */
public interface EventHandler {

    void bind(EventHandlerBinder binder);

    /**
     * Identity reported in {@link EventHandlingError}s.
     */
    default String handlerName() {
        return getClass().getSimpleName();
    }
}
