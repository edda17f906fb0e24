package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.model.CommandOutcome;

/**
 * The command was applied and its events saved. {@code outcome} is
 * {@link CommandOutcome#NOT_MODIFIED} when the target had already seen the command's etag.
 */
public record CommandSucceeded(ScheduledCommand scheduledCommand, CommandOutcome outcome)
    implements ScheduledCommandResult {
}
