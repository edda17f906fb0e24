package com.ivamare.eventsourcing.repository;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.exception.ConcurrencyException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads aggregates by replaying their events and saves their pending events.
 *
 * @param <T> aggregate type
 */
public interface EventSourcedRepository<T extends EventSourcedAggregate> {

    AggregateType<T> aggregateType();

    /**
     * @return the aggregate with all committed events applied, empty if it has none
     */
    Optional<T> getLatest(UUID aggregateId);

    /**
     * @return the aggregate as of sequence number {@code version}
     */
    Optional<T> getVersion(UUID aggregateId, long version);

    /**
     * @return the aggregate with the events recorded at or before {@code asOf}
     */
    Optional<T> getAsOfDate(UUID aggregateId, Instant asOf);

    /**
     * Append the aggregate's pending events atomically, then publish them and wait for the
     * handlers. Nothing is published if the append fails.
     *
     * @throws ConcurrencyException if another writer recorded the same sequence numbers first
     */
    void save(T aggregate);
}
