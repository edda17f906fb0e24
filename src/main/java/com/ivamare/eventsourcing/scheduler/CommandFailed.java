package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.aggregate.Command;

import java.time.Duration;
import java.util.Optional;

/**
 * A failed delivery attempt, handed to the command handler's failure hook so it can decide
 * whether the command is retried or cancelled. The last call to {@link #retry} or
 * {@link #cancel} wins.
 *
 * @param <C> command type
 */
public final class CommandFailed<C extends Command<?>> implements ScheduledCommandResult {

    private final ScheduledCommand scheduledCommand;
    private final C command;
    private final RuntimeException exception;
    private final int numberOfPreviousAttempts;
    private Duration retryAfter;
    private boolean canceled;

    public CommandFailed(ScheduledCommand scheduledCommand, C command, RuntimeException exception, int numberOfPreviousAttempts) {
        this.scheduledCommand = scheduledCommand;
        this.command = command;
        this.exception = exception;
        this.numberOfPreviousAttempts = numberOfPreviousAttempts;
    }

    @Override
    public ScheduledCommand scheduledCommand() {
        return scheduledCommand;
    }

    /**
     * The deserialized command, or null when the stored command could not be read.
     */
    public C getCommand() {
        return command;
    }

    public RuntimeException getException() {
        return exception;
    }

    /**
     * Attempts made before this one.
     */
    public int getNumberOfPreviousAttempts() {
        return numberOfPreviousAttempts;
    }

    public void retry(Duration after) {
        if (after == null || after.isNegative()) {
            throw new IllegalArgumentException("Retry delay must not be negative: " + after);
        }
        this.retryAfter = after;
        this.canceled = false;
    }

    /**
     * Retry as soon as the clock is next advanced.
     */
    public void retry() {
        retry(Duration.ZERO);
    }

    public void cancel() {
        this.canceled = true;
        this.retryAfter = null;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean willBeRetried() {
        return !canceled && retryAfter != null;
    }

    /**
     * Whether {@link #retry} or {@link #cancel} has been called.
     */
    public boolean isDecided() {
        return canceled || retryAfter != null;
    }

    @Override
    public String toString() {
        return "CommandFailed(" + scheduledCommand + ", attempt=" + (numberOfPreviousAttempts + 1)
            + ", exception=" + exception + ", retryAfter=" + retryAfter + ", canceled=" + canceled + ")";
    }
}
