package com.ivamare.eventsourcing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable fact recorded against an aggregate.
 *
 * <p>Subclasses carry the domain payload as plain Jackson-serializable properties and need a
 * no-arg constructor. The metadata held here travels in the {@link StoredEvent} envelope and is
 * never part of the serialized body.
 */
public abstract class Event {

    @JsonIgnore
    private UUID aggregateId;

    @JsonIgnore
    private long sequenceNumber;

    @JsonIgnore
    private Instant timestamp;

    @JsonIgnore
    private String actor;

    @JsonIgnore
    private String etag;

    @JsonIgnore
    private String streamName;

    @JsonIgnore
    private Long absoluteSequenceNumber;

    /**
     * Type name written to storage and matched by handlers.
     */
    public String eventName() {
        return getClass().getSimpleName();
    }

    @JsonIgnore
    public UUID getAggregateId() {
        return aggregateId;
    }

    @JsonIgnore
    public void setAggregateId(UUID aggregateId) {
        this.aggregateId = aggregateId;
    }

    @JsonIgnore
    public long getSequenceNumber() {
        return sequenceNumber;
    }

    @JsonIgnore
    public void setSequenceNumber(long sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
    }

    @JsonIgnore
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @JsonIgnore
    public String getActor() {
        return actor;
    }

    @JsonIgnore
    public void setActor(String actor) {
        this.actor = actor;
    }

    @JsonIgnore
    public String getEtag() {
        return etag;
    }

    @JsonIgnore
    public void setEtag(String etag) {
        this.etag = etag;
    }

    @JsonIgnore
    public String getStreamName() {
        return streamName;
    }

    @JsonIgnore
    public void setStreamName(String streamName) {
        this.streamName = streamName;
    }

    @JsonIgnore
    public Long getAbsoluteSequenceNumber() {
        return absoluteSequenceNumber;
    }

    @JsonIgnore
    public void setAbsoluteSequenceNumber(Long absoluteSequenceNumber) {
        this.absoluteSequenceNumber = absoluteSequenceNumber;
    }

    /**
     * Copy envelope metadata onto this event.
     *
     * @param stored the envelope the event was read from
     */
    public void applyMetadata(StoredEvent stored) {
        this.aggregateId = stored.aggregateId();
        this.sequenceNumber = stored.sequenceNumber();
        this.timestamp = stored.timestamp();
        this.actor = stored.actor();
        this.etag = stored.etag();
        this.streamName = stored.streamName();
        this.absoluteSequenceNumber = stored.absoluteSequenceNumber();
    }

    @Override
    public String toString() {
        return streamName + "." + eventName() + "(aggregateId=" + aggregateId + ", seq=" + sequenceNumber + ")";
    }
}
