package com.ivamare.eventsourcing.scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage of clocks, scheduled commands and their execution errors.
 */
public interface ScheduledCommandStore {

    Optional<SchedulerClock> findClock(String name);

    /**
     * Return the named clock, creating it at {@code startTime} if it does not exist.
     */
    SchedulerClock getOrCreateClock(String name, Instant startTime);

    /**
     * Persist the clock's current time.
     */
    void updateClock(SchedulerClock clock);

    /**
     * Store a command. A sequence number of 0 asks the store to assign the next free negative
     * number for the target.
     *
     * @return the stored command, or empty when the target already has a command with the same
     *         etag or sequence number
     */
    Optional<ScheduledCommand> insert(ScheduledCommand command);

    Optional<ScheduledCommand> find(UUID aggregateId, long sequenceNumber);

    /**
     * Pending commands on the clock due at {@code asOf}, ordered by due time then sequence number.
     * A command without a due time is ordered by its created time.
     */
    List<ScheduledCommand> findDue(String clockName, Instant asOf);

    /**
     * Persist attempt count, due time and terminal markers.
     */
    void update(ScheduledCommand command);

    void addError(CommandExecutionError error);

    List<CommandExecutionError> errors(UUID aggregateId, long sequenceNumber);

    SchedulerStatistics statistics(String clockName, Instant asOf);
}
