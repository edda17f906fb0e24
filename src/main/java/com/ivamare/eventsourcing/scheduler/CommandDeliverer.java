package com.ivamare.eventsourcing.scheduler;

import java.time.Instant;

/**
 * Makes one delivery attempt for a stored command and records its outcome in the store.
 */
public interface CommandDeliverer {

    /**
     * @param command stored command
     * @param now clock time of the attempt
     * @return the outcome; {@link CommandSkipped} if the command is no longer pending and
     *         {@link CommandPending} if its precondition does not hold yet
     */
    ScheduledCommandResult deliver(ScheduledCommand command, Instant now);
}
