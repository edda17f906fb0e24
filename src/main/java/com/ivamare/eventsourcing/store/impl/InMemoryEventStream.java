package com.ivamare.eventsourcing.store.impl;

import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.model.StoredEvent;
import com.ivamare.eventsourcing.store.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Event stream held in memory. Appends are serialized; readers get copies.
 */
public class InMemoryEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStream.class);

    private final Map<UUID, NavigableMap<Long, StoredEvent>> streams = new HashMap<>();
    private long absoluteSequence;

    @Override
    public synchronized List<StoredEvent> appendAll(List<StoredEvent> events) {
        Set<String> batchKeys = new HashSet<>();
        for (StoredEvent event : events) {
            NavigableMap<Long, StoredEvent> stream = streams.get(event.aggregateId());
            boolean taken = stream != null && stream.containsKey(event.sequenceNumber());
            if (taken || !batchKeys.add(event.aggregateId() + ":" + event.sequenceNumber())) {
                log.debug("Rejected append of {} seq={}: sequence number taken",
                    event.aggregateId(), event.sequenceNumber());
                throw new ConcurrencyException("Sequence number " + event.sequenceNumber()
                    + " already recorded for aggregate " + event.aggregateId());
            }
        }

        List<StoredEvent> stored = new ArrayList<>(events.size());
        for (StoredEvent event : events) {
            StoredEvent withPosition = event.withAbsoluteSequenceNumber(++absoluteSequence);
            streams.computeIfAbsent(event.aggregateId(), id -> new TreeMap<>())
                .put(event.sequenceNumber(), withPosition);
            stored.add(withPosition);
        }
        return stored;
    }

    @Override
    public synchronized Optional<StoredEvent> latest(UUID aggregateId) {
        NavigableMap<Long, StoredEvent> stream = streams.get(aggregateId);
        return stream == null || stream.isEmpty() ? Optional.empty() : Optional.of(stream.lastEntry().getValue());
    }

    @Override
    public List<StoredEvent> all(UUID aggregateId) {
        return select(aggregateId, e -> true);
    }

    @Override
    public List<StoredEvent> asOfDate(UUID aggregateId, Instant asOf) {
        return select(aggregateId, e -> e.timestamp() == null || !e.timestamp().isAfter(asOf));
    }

    @Override
    public List<StoredEvent> upToVersion(UUID aggregateId, long version) {
        return select(aggregateId, e -> e.sequenceNumber() <= version);
    }

    @Override
    public List<StoredEvent> afterVersion(UUID aggregateId, long version) {
        return select(aggregateId, e -> e.sequenceNumber() > version);
    }

    @Override
    public boolean hasETag(UUID aggregateId, String etag) {
        return etag != null && !select(aggregateId, e -> etag.equals(e.etag())).isEmpty();
    }

    /**
     * Total number of stored events across all aggregates.
     */
    public synchronized long size() {
        return streams.values().stream().mapToLong(Map::size).sum();
    }

    private synchronized List<StoredEvent> select(UUID aggregateId, Predicate<StoredEvent> filter) {
        NavigableMap<Long, StoredEvent> stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        return stream.values().stream().filter(filter).toList();
    }
}
