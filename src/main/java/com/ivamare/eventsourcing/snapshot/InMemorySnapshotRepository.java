package com.ivamare.eventsourcing.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Keeps every snapshot in memory, indexed by aggregate and version.
 */
public class InMemorySnapshotRepository implements SnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotRepository.class);

    private final Map<UUID, NavigableMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> getSnapshot(UUID aggregateId, Long maxVersion, Instant asOf) {
        NavigableMap<Long, Snapshot> byVersion = snapshots.get(aggregateId);
        if (byVersion == null) {
            return Optional.empty();
        }
        NavigableMap<Long, Snapshot> candidates = maxVersion != null
            ? byVersion.headMap(maxVersion, true)
            : byVersion;
        for (Snapshot snapshot : candidates.descendingMap().values()) {
            if (asOf == null || snapshot.lastUpdated() == null || !snapshot.lastUpdated().isAfter(asOf)) {
                return Optional.of(snapshot);
            }
        }
        return Optional.empty();
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.aggregateId(), id -> new ConcurrentSkipListMap<>())
            .put(snapshot.version(), snapshot);
        log.debug("Saved snapshot of {} {} at version {}",
            snapshot.aggregateType(), snapshot.aggregateId(), snapshot.version());
    }

    /**
     * Drop every snapshot. Loads fall back to full replay.
     */
    public void clear() {
        snapshots.clear();
    }
}
