package com.ivamare.eventsourcing.snapshot;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for snapshots.
 */
public interface SnapshotRepository {

    /**
     * Find the most recent usable snapshot.
     *
     * @param aggregateId aggregate id
     * @param maxVersion ignore snapshots above this version, null for no limit
     * @param asOf ignore snapshots of state recorded after this time, null for no limit
     * @return the snapshot, if any
     */
    Optional<Snapshot> getSnapshot(UUID aggregateId, Long maxVersion, Instant asOf);

    void saveSnapshot(Snapshot snapshot);
}
