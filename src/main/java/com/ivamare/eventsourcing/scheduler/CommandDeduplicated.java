package com.ivamare.eventsourcing.scheduler;

/**
 * The target already had a scheduled command with the same etag or sequence number; nothing
 * was stored.
 */
public record CommandDeduplicated(ScheduledCommand scheduledCommand) implements ScheduledCommandResult {
}
