package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.scheduler.CommandFailed;

/**
 * Enacts one command type against its target aggregate.
 *
 * <p>Example:
 * <pre>
 * AggregateType.builder(Order.class, Order::new)
 *     .command(AddItem.class, (order, cmd) -&gt; order.addItem(cmd))
 *     .build();
 * </pre>
 *
 * @param <T> aggregate type
 * @param <C> command type
 */
@FunctionalInterface
public interface CommandHandler<T extends EventSourcedAggregate, C extends Command<T>> {

    /**
     * Record the events that result from the command. Runs after validation succeeded.
     */
    void enactCommand(T target, C command);

    /**
     * Called with a freshly loaded target when scheduled delivery of the command failed.
     *
     * <p>May call {@link CommandFailed#retry}, {@link CommandFailed#cancel}, or record
     * compensating events on the target (saved afterwards). Doing nothing leaves the decision to
     * the command type's retry policy.
     */
    default void handleScheduledCommandException(T target, CommandFailed<C> failure) {
    }
}
