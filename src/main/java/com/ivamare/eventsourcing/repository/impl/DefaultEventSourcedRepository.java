package com.ivamare.eventsourcing.repository.impl;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.bus.EventBus;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.StoredEvent;
import com.ivamare.eventsourcing.repository.EventSourcedRepository;
import com.ivamare.eventsourcing.serialization.EventSerializer;
import com.ivamare.eventsourcing.snapshot.JsonSnapshotter;
import com.ivamare.eventsourcing.snapshot.Snapshot;
import com.ivamare.eventsourcing.snapshot.SnapshotRepository;
import com.ivamare.eventsourcing.snapshot.SnapshotSupport;
import com.ivamare.eventsourcing.store.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Repository over a pluggable {@link EventStream}.
 *
 * <p>Replay skips events that cannot be read; the version is still the highest stored sequence
 * number. When a {@link SnapshotRepository} is configured and the aggregate type supports
 * snapshots, loading starts from the latest usable snapshot and replays only the events after it.
 */
public class DefaultEventSourcedRepository<T extends EventSourcedAggregate> implements EventSourcedRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventSourcedRepository.class);

    private final AggregateType<T> type;
    private final EventStream eventStream;
    private final EventSerializer serializer;
    private final EventBus eventBus;
    private final Clock clock;
    private final SnapshotRepository snapshotRepository;
    private final JsonSnapshotter snapshotter;

    public DefaultEventSourcedRepository(
            AggregateType<T> type,
            EventStream eventStream,
            EventSerializer serializer,
            EventBus eventBus,
            Clock clock) {
        this(type, eventStream, serializer, eventBus, clock, null);
    }

    public DefaultEventSourcedRepository(
            AggregateType<T> type,
            EventStream eventStream,
            EventSerializer serializer,
            EventBus eventBus,
            Clock clock,
            SnapshotRepository snapshotRepository) {
        this.type = type;
        this.eventStream = eventStream;
        this.serializer = serializer;
        this.eventBus = eventBus;
        this.clock = clock;
        this.snapshotRepository = snapshotRepository;
        this.snapshotter = new JsonSnapshotter(serializer.objectMapper());
    }

    @Override
    public AggregateType<T> aggregateType() {
        return type;
    }

    @Override
    public Optional<T> getLatest(UUID aggregateId) {
        return load(aggregateId, null, null);
    }

    @Override
    public Optional<T> getVersion(UUID aggregateId, long version) {
        return load(aggregateId, version, null);
    }

    @Override
    public Optional<T> getAsOfDate(UUID aggregateId, Instant asOf) {
        return load(aggregateId, null, asOf);
    }

    private Optional<T> load(UUID aggregateId, Long version, Instant asOf) {
        Optional<Snapshot> snapshot = findSnapshot(aggregateId, version, asOf);
        if (snapshot.isPresent()) {
            Optional<T> restored = loadFromSnapshot(snapshot.get(), version, asOf);
            if (restored.isPresent()) {
                return restored;
            }
        }

        List<StoredEvent> stored;
        if (version != null) {
            stored = eventStream.upToVersion(aggregateId, version);
        } else if (asOf != null) {
            stored = eventStream.asOfDate(aggregateId, asOf);
        } else {
            stored = eventStream.all(aggregateId);
        }
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        T aggregate = type.fromEventHistory(aggregateId, readAll(stored), maxSequenceNumber(stored));
        log.debug("Loaded {} {} at version {} from {} stored events",
            type.name(), aggregateId, aggregate.getVersion(), stored.size());
        return Optional.of(aggregate);
    }

    private Optional<T> loadFromSnapshot(Snapshot snapshot, Long version, Instant asOf) {
        SnapshotSupport<T, ?> support = type.snapshotSupport().orElseThrow();
        Object state;
        try {
            state = snapshotter.readState(snapshot, support.stateType());
        } catch (EventSerializationException e) {
            log.warn("Ignoring unreadable snapshot of {} {} at version {}: {}",
                type.name(), snapshot.aggregateId(), snapshot.version(), e.getMessage());
            return Optional.empty();
        }

        List<StoredEvent> delta = eventStream.afterVersion(snapshot.aggregateId(), snapshot.version()).stream()
            .filter(e -> version == null || e.sequenceNumber() <= version)
            .filter(e -> asOf == null || e.timestamp() == null || !e.timestamp().isAfter(asOf))
            .toList();
        long storedVersion = Math.max(snapshot.version(), maxSequenceNumber(delta));

        T aggregate = type.fromSnapshot(snapshot, state, readAll(delta), storedVersion);
        log.debug("Loaded {} {} at version {} from snapshot {} and {} stored events",
            type.name(), snapshot.aggregateId(), aggregate.getVersion(), snapshot.version(), delta.size());
        return Optional.of(aggregate);
    }

    private Optional<Snapshot> findSnapshot(UUID aggregateId, Long version, Instant asOf) {
        if (snapshotRepository == null || type.snapshotSupport().isEmpty()) {
            return Optional.empty();
        }
        return snapshotRepository.getSnapshot(aggregateId, version, asOf);
    }

    private List<Event> readAll(List<StoredEvent> stored) {
        List<Event> events = new ArrayList<>(stored.size());
        for (StoredEvent storedEvent : stored) {
            serializer.deserialize(storedEvent, type).ifPresent(events::add);
        }
        return events;
    }

    private static long maxSequenceNumber(List<StoredEvent> stored) {
        return stored.stream().mapToLong(StoredEvent::sequenceNumber).max().orElse(0);
    }

    @Override
    public void save(T aggregate) {
        List<Event> pending = aggregate.getPendingEvents();
        if (pending.isEmpty()) {
            return;
        }

        Instant now = clock.now();
        List<StoredEvent> toStore = new ArrayList<>(pending.size());
        for (Event event : pending) {
            if (event.getTimestamp() == null) {
                event.setTimestamp(now);
            }
            if (event.getStreamName() == null) {
                event.setStreamName(type.name());
            }
            toStore.add(serializer.toStoredEvent(event));
        }

        List<StoredEvent> appended;
        try {
            appended = eventStream.appendAll(toStore);
        } catch (ConcurrencyException e) {
            log.warn("Concurrency conflict saving {} {} (seq {}..{})", type.name(), aggregate.getId(),
                pending.get(0).getSequenceNumber(), pending.get(pending.size() - 1).getSequenceNumber());
            throw new ConcurrencyException(
                "Another writer recorded events for " + type.name() + " " + aggregate.getId()
                    + " at version " + aggregate.getVersion(),
                pending,
                e.getCause() != null ? e.getCause() : e);
        }

        for (int i = 0; i < pending.size() && i < appended.size(); i++) {
            pending.get(i).setAbsoluteSequenceNumber(appended.get(i).absoluteSequenceNumber());
        }
        aggregate.confirmSave();
        log.debug("Saved {} events for {} {}, now at version {}",
            pending.size(), type.name(), aggregate.getId(), aggregate.getVersion());

        try {
            eventBus.publish(pending).join();
        } catch (CompletionException | CancellationException e) {
            log.error("Publishing events of {} {} failed after save", type.name(), aggregate.getId(),
                e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Store a snapshot of the committed state of {@code aggregate}.
     *
     * @throws IllegalStateException if no snapshot repository is configured or the aggregate
     *         type does not support snapshots
     */
    public Snapshot snapshot(T aggregate) {
        if (snapshotRepository == null) {
            throw new IllegalStateException("No snapshot repository configured for " + type.name());
        }
        Snapshot snapshot = snapshotter.create(type, aggregate);
        snapshotRepository.saveSnapshot(snapshot);
        return snapshot;
    }
}
