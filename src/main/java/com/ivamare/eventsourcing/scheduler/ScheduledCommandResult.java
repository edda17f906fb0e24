package com.ivamare.eventsourcing.scheduler;

/**
 * Outcome of scheduling or delivering a command.
 */
public sealed interface ScheduledCommandResult
    permits CommandSucceeded, CommandFailed, CommandDeduplicated, CommandPending, CommandSkipped {

    /**
     * The stored command as it was before this outcome was recorded.
     */
    ScheduledCommand scheduledCommand();
}
