package com.ivamare.eventsourcing.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * What happened while a clock was advanced.
 *
 * @param clockName advanced clock
 * @param advancedTo new clock time
 * @param successfulCommands commands applied
 * @param failedCommands commands that failed, retried or not
 * @param pendingCommands due commands still blocked by a precondition
 */
public record SchedulerAdvancedResult(
    String clockName,
    Instant advancedTo,
    List<CommandSucceeded> successfulCommands,
    List<CommandFailed<?>> failedCommands,
    List<CommandPending> pendingCommands
) {

    public SchedulerAdvancedResult {
        successfulCommands = List.copyOf(successfulCommands);
        failedCommands = List.copyOf(failedCommands);
        pendingCommands = List.copyOf(pendingCommands);
    }

    public static SchedulerAdvancedResult empty(String clockName, Instant at) {
        return new SchedulerAdvancedResult(clockName, at, List.of(), List.of(), List.of());
    }

    public int deliveredCount() {
        return successfulCommands.size() + failedCommands.size();
    }
}
