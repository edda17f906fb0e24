package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;

import java.time.Instant;
import java.util.UUID;

/**
 * Stores commands for later delivery. A command that is already due and not blocked by a
 * precondition is delivered before {@code schedule} returns.
 *
 * <p>Example:
 * <pre>
 * scheduler.schedule(orderType, orderId, new ShipOrder(), clockNow.plus(Duration.ofDays(1)));
 * </pre>
 */
public interface CommandScheduler {

    default <T extends EventSourcedAggregate> ScheduledCommandResult schedule(
            AggregateType<T> type, UUID aggregateId, Command<T> command) {
        return schedule(type, aggregateId, command, null, null, null);
    }

    default <T extends EventSourcedAggregate> ScheduledCommandResult schedule(
            AggregateType<T> type, UUID aggregateId, Command<T> command, Instant dueTime) {
        return schedule(type, aggregateId, command, dueTime, null, null);
    }

    /**
     * @param type target aggregate type
     * @param aggregateId target aggregate
     * @param command command to deliver; an etag is assigned if it has none
     * @param dueTime earliest delivery time on the clock, null for as soon as possible
     * @param precondition optional delivery gate
     * @param clockName clock to schedule on, null for the default clock
     */
    <T extends EventSourcedAggregate> ScheduledCommandResult schedule(
        AggregateType<T> type, UUID aggregateId, Command<T> command,
        Instant dueTime, DeliveryPrecondition precondition, String clockName);

    /**
     * Store the command announced by a committed {@link CommandScheduled} event, keyed by the
     * event's sequence number and gated on the event itself.
     */
    ScheduledCommandResult schedule(CommandScheduled announcement);
}
