package com.ivamare.eventsourcing.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted intent to deliver a command to an aggregate at or after a due time.
 *
 * <p>{@code appliedTime} and {@code finalAttemptTime} are the terminal markers: a command with
 * either set is never delivered again.
 *
 * @param aggregateId target aggregate
 * @param sequenceNumber unique per target: the announcing event's sequence number, or a
 *        negative number assigned by the store
 * @param aggregateType target aggregate type name
 * @param commandName command name
 * @param serializedCommand command JSON
 * @param etag command etag, unique per target
 * @param createdTime clock time the command was scheduled at
 * @param dueTime earliest delivery time, null for as soon as possible
 * @param appliedTime time of successful delivery
 * @param finalAttemptTime time of the last attempt of a cancelled or exhausted command
 * @param attempts number of delivery attempts so far
 * @param clockName clock the command is due against
 * @param precondition optional delivery gate
 */
public record ScheduledCommand(
    UUID aggregateId,
    long sequenceNumber,
    String aggregateType,
    String commandName,
    String serializedCommand,
    String etag,
    Instant createdTime,
    Instant dueTime,
    Instant appliedTime,
    Instant finalAttemptTime,
    int attempts,
    String clockName,
    DeliveryPrecondition precondition
) {

    public boolean isDelivered() {
        return appliedTime != null;
    }

    public boolean isFinal() {
        return finalAttemptTime != null;
    }

    public boolean isPending() {
        return appliedTime == null && finalAttemptTime == null;
    }

    public boolean isDue(Instant now) {
        return isPending() && (dueTime == null || !dueTime.isAfter(now));
    }

    public ScheduledCommand withSequenceNumber(long sequenceNumber) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, etag,
            createdTime, dueTime, appliedTime, finalAttemptTime, attempts, clockName, precondition);
    }

    /**
     * @param now clock time of the successful attempt
     */
    public ScheduledCommand recordSuccess(Instant now) {
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, etag,
            createdTime, dueTime, now, finalAttemptTime, attempts + 1, clockName, precondition);
    }

    /**
     * @param now clock time of the failed attempt
     * @param retryAfter delay before the next attempt, null to finalize the command
     */
    public ScheduledCommand recordFailure(Instant now, Duration retryAfter) {
        Instant nextDue = retryAfter != null ? now.plus(retryAfter) : dueTime;
        Instant finalTime = retryAfter != null ? null : now;
        return new ScheduledCommand(aggregateId, sequenceNumber, aggregateType, commandName, serializedCommand, etag,
            createdTime, nextDue, appliedTime, finalTime, attempts + 1, clockName, precondition);
    }

    @Override
    public String toString() {
        return aggregateType + "." + commandName + "(aggregateId=" + aggregateId + ", seq=" + sequenceNumber
            + ", due=" + dueTime + ", attempts=" + attempts + ")";
    }
}
