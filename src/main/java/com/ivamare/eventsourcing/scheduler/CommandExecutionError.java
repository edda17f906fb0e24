package com.ivamare.eventsourcing.scheduler;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of one failed delivery attempt.
 *
 * @param aggregateId target aggregate
 * @param sequenceNumber scheduled command sequence number
 * @param attempt 1-based attempt number
 * @param occurredAt clock time of the attempt
 * @param exceptionType class name of the failure
 * @param message failure message
 * @param finalAttempt whether the command was finalized by this failure
 */
public record CommandExecutionError(
    UUID aggregateId,
    long sequenceNumber,
    int attempt,
    Instant occurredAt,
    String exceptionType,
    String message,
    boolean finalAttempt
) {
}
