package com.ivamare.eventsourcing.store.impl;

import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.model.StoredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryEventStream")
class InMemoryEventStreamTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryEventStream stream;
    private UUID aggregateId;

    @BeforeEach
    void setUp() {
        stream = new InMemoryEventStream();
        aggregateId = UUID.randomUUID();
    }

    private StoredEvent event(long seq, String etag) {
        return new StoredEvent(aggregateId, seq, "Order", "ItemAdded", "{}", START.plusSeconds(seq), etag, "alice", null);
    }

    @Test
    @DisplayName("should assign increasing absolute sequence numbers")
    void shouldAssignAbsoluteSequenceNumbers() {
        List<StoredEvent> stored = stream.appendAll(List.of(event(1, "a"), event(2, "b")));
        StoredEvent other = stream.append(new StoredEvent(
            UUID.randomUUID(), 1, "Order", "Created", "{}", START, "c", null, null));

        assertEquals(1L, stored.get(0).absoluteSequenceNumber());
        assertEquals(2L, stored.get(1).absoluteSequenceNumber());
        assertEquals(3L, other.absoluteSequenceNumber());
        assertEquals(3, stream.size());
    }

    @Test
    @DisplayName("should reject the whole batch when one sequence number is taken")
    void shouldRejectWholeBatchOnConflict() {
        stream.append(event(2, "a"));

        assertThrows(ConcurrencyException.class, () -> stream.appendAll(List.of(event(1, "b"), event(2, "c"))));
        assertEquals(1, stream.all(aggregateId).size());
    }

    @Test
    @DisplayName("should reject duplicate sequence numbers within a batch")
    void shouldRejectDuplicatesWithinBatch() {
        assertThrows(ConcurrencyException.class, () -> stream.appendAll(List.of(event(1, "a"), event(1, "b"))));
        assertTrue(stream.all(aggregateId).isEmpty());
    }

    @Test
    @DisplayName("should select by version and time")
    void shouldSelectByVersionAndTime() {
        stream.appendAll(List.of(event(1, "a"), event(2, "b"), event(5, "c")));

        assertEquals(2, stream.upToVersion(aggregateId, 4).size());
        assertEquals(1, stream.afterVersion(aggregateId, 2).size());
        assertEquals(2, stream.asOfDate(aggregateId, START.plusSeconds(2)).size());
        assertEquals(5, stream.latest(aggregateId).orElseThrow().sequenceNumber());
        assertEquals(6, stream.nextVersion(aggregateId));
        assertEquals(1, stream.nextVersion(UUID.randomUUID()));
    }

    @Test
    @DisplayName("should find recorded etags")
    void shouldFindRecordedEtags() {
        stream.append(event(1, "a"));

        assertTrue(stream.hasETag(aggregateId, "a"));
        assertFalse(stream.hasETag(aggregateId, "b"));
        assertFalse(stream.hasETag(UUID.randomUUID(), "a"));
        assertFalse(stream.hasETag(aggregateId, null));
    }
}
