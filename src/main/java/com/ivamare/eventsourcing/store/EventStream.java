package com.ivamare.eventsourcing.store;

import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.model.StoredEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, per-aggregate ordered log of stored events.
 *
 * <p>(aggregateId, sequenceNumber) is unique. Every query returns events ordered by sequence
 * number.
 */
public interface EventStream {

    /**
     * Append one event.
     *
     * @return the event with its absolute sequence number
     * @throws ConcurrencyException if the sequence number is taken
     */
    default StoredEvent append(StoredEvent event) {
        return appendAll(List.of(event)).get(0);
    }

    /**
     * Append a batch atomically: all events are stored or none.
     *
     * @return the events with their absolute sequence numbers
     * @throws ConcurrencyException if any sequence number is taken
     */
    List<StoredEvent> appendAll(List<StoredEvent> events);

    Optional<StoredEvent> latest(UUID aggregateId);

    List<StoredEvent> all(UUID aggregateId);

    /**
     * Events recorded at or before {@code asOf}.
     */
    List<StoredEvent> asOfDate(UUID aggregateId, Instant asOf);

    /**
     * Events with sequence number at most {@code version}.
     */
    List<StoredEvent> upToVersion(UUID aggregateId, long version);

    /**
     * Events with sequence number greater than {@code version}.
     */
    List<StoredEvent> afterVersion(UUID aggregateId, long version);

    /**
     * Whether an event with {@code etag} was recorded for the aggregate.
     */
    boolean hasETag(UUID aggregateId, String etag);

    default long nextVersion(UUID aggregateId) {
        return latest(aggregateId).map(e -> e.sequenceNumber() + 1).orElse(1L);
    }
}
