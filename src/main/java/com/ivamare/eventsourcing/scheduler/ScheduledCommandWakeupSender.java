package com.ivamare.eventsourcing.scheduler;

/**
 * Notified whenever a command is stored, so something can arrange to deliver it at its due time.
 */
@FunctionalInterface
public interface ScheduledCommandWakeupSender {

    void commandScheduled(ScheduledCommand command);

    static ScheduledCommandWakeupSender none() {
        return command -> { };
    }
}
