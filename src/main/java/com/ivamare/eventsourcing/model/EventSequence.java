package com.ivamare.eventsourcing.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Ordered set of events belonging to one aggregate.
 *
 * <p>Events without a sequence number are numbered contiguously after the highest number seen
 * (and never below {@code startFrom + 1}). Two events can never share a sequence number. The
 * version is the highest sequence number ever added, or a value set explicitly while the
 * sequence is empty.
 */
public class EventSequence implements Iterable<Event> {

    private final UUID aggregateId;
    private final long startFrom;
    private final NavigableMap<Long, Event> events = new TreeMap<>();
    private long version;

    public EventSequence(UUID aggregateId) {
        this(aggregateId, 0);
    }

    public EventSequence(UUID aggregateId, long startFrom) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.startFrom = startFrom;
    }

    /**
     * Add an event, stamping aggregate id and sequence number when missing.
     *
     * @param event the event
     * @throws IllegalArgumentException if the event belongs to another aggregate or its
     *         sequence number is taken
     */
    public void add(Event event) {
        Objects.requireNonNull(event, "event");
        if (event.getAggregateId() == null) {
            event.setAggregateId(aggregateId);
        } else if (!aggregateId.equals(event.getAggregateId())) {
            throw new IllegalArgumentException(
                "Event for aggregate " + event.getAggregateId() + " cannot be added to sequence of " + aggregateId);
        }

        if (event.getSequenceNumber() == 0) {
            event.setSequenceNumber(Math.max(version + 1, events.size() + 1 + startFrom));
        }

        if (events.containsKey(event.getSequenceNumber())) {
            throw new IllegalArgumentException(
                "Sequence for " + aggregateId + " already contains an event with sequence number "
                    + event.getSequenceNumber());
        }

        events.put(event.getSequenceNumber(), event);
        version = Math.max(version, event.getSequenceNumber());
    }

    public void addAll(Iterable<? extends Event> toAdd) {
        for (Event event : toAdd) {
            add(event);
        }
    }

    /**
     * Move every event into {@code target}, leaving this sequence empty.
     */
    public void transferTo(EventSequence target) {
        for (Map.Entry<Long, Event> entry : events.entrySet()) {
            target.add(entry.getValue());
        }
        target.version = Math.max(target.version, version);
        events.clear();
    }

    /**
     * Force the version of an empty sequence.
     *
     * @param version the version to report
     * @throws IllegalStateException if events were already added
     */
    public void setVersion(long version) {
        if (!events.isEmpty()) {
            throw new IllegalStateException("Version can only be set on an empty sequence");
        }
        this.version = version;
    }

    public long version() {
        return version;
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Whether any event in this sequence carries the given etag.
     */
    public boolean containsETag(String etag) {
        if (etag == null) {
            return false;
        }
        for (Event event : events.values()) {
            if (etag.equals(event.getEtag())) {
                return true;
            }
        }
        return false;
    }

    public List<Event> toList() {
        return new ArrayList<>(events.values());
    }

    public Stream<Event> stream() {
        return events.values().stream();
    }

    @Override
    public Iterator<Event> iterator() {
        return events.values().iterator();
    }
}
