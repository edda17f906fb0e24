package com.ivamare.eventsourcing.scheduler;

/**
 * The command is stored and waiting.
 *
 * @param scheduledCommand stored command
 * @param reason why it was not delivered yet
 */
public record CommandPending(ScheduledCommand scheduledCommand, Reason reason) implements ScheduledCommandResult {

    public enum Reason {
        NOT_DUE,
        PRECONDITION_NOT_MET,
        IN_DELIVERY
    }
}
