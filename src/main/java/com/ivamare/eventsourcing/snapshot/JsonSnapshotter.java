package com.ivamare.eventsourcing.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.model.Event;

import java.time.Instant;
import java.util.List;

/**
 * Creates and reads snapshots whose body is the JSON form of the state captured by the
 * aggregate type's {@link SnapshotSupport}.
 */
public class JsonSnapshotter {

    private final ObjectMapper objectMapper;

    public JsonSnapshotter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Capture the committed state of {@code aggregate}. Pending events are not included.
     *
     * @throws IllegalStateException if the aggregate type does not support snapshots or the
     *         aggregate has uncommitted events
     */
    public <T extends EventSourcedAggregate> Snapshot create(AggregateType<T> type, T aggregate) {
        SnapshotSupport<T, ?> support = type.snapshotSupport()
            .orElseThrow(() -> new IllegalStateException(type.name() + " does not support snapshots"));
        if (aggregate.hasPendingEvents()) {
            throw new IllegalStateException("Cannot snapshot " + type.name() + " " + aggregate.getId()
                + " with uncommitted events");
        }
        List<Event> history = aggregate.getEventHistory();
        Instant lastUpdated = history.isEmpty() ? null : history.get(history.size() - 1).getTimestamp();
        try {
            return new Snapshot(
                aggregate.getId(),
                type.name(),
                aggregate.getVersion(),
                lastUpdated,
                objectMapper.writeValueAsString(support.capture(aggregate)),
                aggregate.committedETags()
            );
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot snapshot " + type.name() + " " + aggregate.getId(), e);
        }
    }

    /**
     * Read the state stored in {@code snapshot}.
     */
    public <S> S readState(Snapshot snapshot, Class<S> stateType) {
        try {
            return objectMapper.readValue(snapshot.body(), stateType);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Unreadable snapshot of " + snapshot.aggregateType()
                + " " + snapshot.aggregateId(), e);
        }
    }
}
