package com.ivamare.eventsourcing.snapshot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemorySnapshotRepository")
class InMemorySnapshotRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemorySnapshotRepository repository;
    private UUID aggregateId;

    @BeforeEach
    void setUp() {
        repository = new InMemorySnapshotRepository();
        aggregateId = UUID.randomUUID();
        repository.saveSnapshot(snapshot(3, T0));
        repository.saveSnapshot(snapshot(7, T0.plusSeconds(3600)));
    }

    private Snapshot snapshot(long version, Instant lastUpdated) {
        return new Snapshot(aggregateId, "Order", version, lastUpdated, "{}", Set.of("e" + version));
    }

    @Test
    @DisplayName("should return the newest snapshot when unconstrained")
    void shouldReturnNewestSnapshot() {
        assertEquals(7L, repository.getSnapshot(aggregateId, null, null).orElseThrow().version());
    }

    @Test
    @DisplayName("should return the newest snapshot at or below the version bound")
    void shouldRespectVersionBound() {
        assertEquals(3L, repository.getSnapshot(aggregateId, 6L, null).orElseThrow().version());
        assertEquals(7L, repository.getSnapshot(aggregateId, 7L, null).orElseThrow().version());
        assertTrue(repository.getSnapshot(aggregateId, 2L, null).isEmpty());
    }

    @Test
    @DisplayName("should ignore snapshots taken after the as-of time")
    void shouldRespectAsOfTime() {
        assertEquals(3L, repository.getSnapshot(aggregateId, null, T0.plusSeconds(60)).orElseThrow().version());
        assertTrue(repository.getSnapshot(aggregateId, null, T0.minusSeconds(1)).isEmpty());
    }

    @Test
    @DisplayName("should replace a snapshot saved again at the same version")
    void shouldReplaceSameVersion() {
        repository.saveSnapshot(new Snapshot(aggregateId, "Order", 7, T0.plusSeconds(3600), "{\"v\":2}", null));

        Snapshot stored = repository.getSnapshot(aggregateId, null, null).orElseThrow();
        assertEquals("{\"v\":2}", stored.body());
        assertTrue(stored.etags().isEmpty());
    }

    @Test
    @DisplayName("should lose nothing but speed when cleared")
    void shouldBeEmptyAfterClear() {
        repository.clear();

        assertTrue(repository.getSnapshot(aggregateId, null, null).isEmpty());
        assertTrue(repository.getSnapshot(UUID.randomUUID(), null, null).isEmpty());
    }
}
