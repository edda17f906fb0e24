package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Storage envelope of an event: metadata plus the JSON body.
 *
 * @param aggregateId aggregate the event belongs to
 * @param sequenceNumber 1-based position in the aggregate's stream
 * @param streamName aggregate type name
 * @param type event type name
 * @param body serialized payload
 * @param timestamp UTC time the event was recorded
 * @param etag optional idempotency token
 * @param actor optional principal name
 * @param absoluteSequenceNumber position across all streams, assigned by storage (null before append)
 */
public record StoredEvent(
    UUID aggregateId,
    long sequenceNumber,
    String streamName,
    String type,
    String body,
    Instant timestamp,
    String etag,
    String actor,
    Long absoluteSequenceNumber
) {

    public StoredEvent {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId is required");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive, was " + sequenceNumber);
        }
    }

    public StoredEvent withAbsoluteSequenceNumber(long absolute) {
        return new StoredEvent(aggregateId, sequenceNumber, streamName, type, body, timestamp, etag, actor, absolute);
    }
}
