package com.ivamare.eventsourcing.scheduler;

/**
 * Delivery was requested for a command that was already applied or finalized.
 */
public record CommandSkipped(ScheduledCommand scheduledCommand) implements ScheduledCommandResult {
}
