package com.ivamare.eventsourcing.snapshot;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Cached aggregate state at a version. Never authoritative: the event stream can always
 * rebuild it.
 *
 * @param aggregateId aggregate id
 * @param aggregateType aggregate type name
 * @param version sequence number of the last event folded into the state
 * @param lastUpdated timestamp of that event
 * @param body serialized state
 * @param etags etags of every event folded into the state
 */
public record Snapshot(
    UUID aggregateId,
    String aggregateType,
    long version,
    Instant lastUpdated,
    String body,
    Set<String> etags
) {
    public Snapshot {
        etags = etags != null ? Set.copyOf(etags) : Set.of();
    }
}
