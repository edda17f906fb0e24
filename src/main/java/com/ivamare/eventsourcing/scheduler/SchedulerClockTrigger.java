package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.exception.SchedulingException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Advances named clocks and delivers the commands that become due, one at a time in due order.
 */
public interface SchedulerClockTrigger {

    /**
     * @throws SchedulingException if the clock does not exist or {@code by} is negative
     */
    SchedulerAdvancedResult advanceClock(String clockName, Duration by);

    /**
     * @throws SchedulingException if the clock does not exist or {@code to} is before its
     *         current time
     */
    SchedulerAdvancedResult advanceClock(String clockName, Instant to);

    /**
     * Advance the clock to {@code now} unless it is already there or later, creating it if it
     * does not exist. Used by real-time workers.
     */
    SchedulerAdvancedResult catchUp(String clockName, Instant now);

    /**
     * Deliver one command if it is pending and due on its clock. Safe to call repeatedly and from
     * several threads: while one thread delivers a command, other callers get a
     * {@link CommandPending} with reason {@code IN_DELIVERY} instead of a second delivery.
     *
     * @return empty if no such command exists
     */
    Optional<ScheduledCommandResult> deliver(UUID aggregateId, long sequenceNumber);
}
