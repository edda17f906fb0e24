package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.Event;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.UUID;

/**
 * A handler failed on an event. Published on the bus's error channel; never thrown to the
 * publisher.
 */
public class EventHandlingError {

    /** MDC key whose value, when present, becomes the correlation id. */
    public static final String CORRELATION_ID_KEY = "correlationId";

    private final Throwable exception;
    private final String handlerName;
    private final Event event;
    private final UUID aggregateId;
    private final long sequenceNumber;
    private final String streamName;
    private final String eventType;
    private final String correlationId;
    private final Instant occurredAt;

    public EventHandlingError(Throwable exception, String handlerName, Event event) {
        this(exception, handlerName, event, event.getAggregateId(), event.getSequenceNumber(),
            event.getStreamName(), event.eventName());
    }

    protected EventHandlingError(Throwable exception, String handlerName, Event event, UUID aggregateId,
                                 long sequenceNumber, String streamName, String eventType) {
        this.exception = exception;
        this.handlerName = handlerName;
        this.event = event;
        this.aggregateId = aggregateId;
        this.sequenceNumber = sequenceNumber;
        this.streamName = streamName;
        this.eventType = eventType;
        String mdcCorrelation = MDC.get(CORRELATION_ID_KEY);
        this.correlationId = mdcCorrelation != null ? mdcCorrelation : UUID.randomUUID().toString();
        this.occurredAt = Instant.now();
    }

    public Throwable getException() {
        return exception;
    }

    public String getHandlerName() {
        return handlerName;
    }

    /**
     * The event being handled, null when it could not be read.
     */
    public Event getEvent() {
        return event;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public String getStreamName() {
        return streamName;
    }

    public String getEventType() {
        return eventType;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(handler=" + handlerName + ", event=" + streamName + "." + eventType
            + ", aggregateId=" + aggregateId + ", seq=" + sequenceNumber + ", error=" + exception + ")";
    }
}
