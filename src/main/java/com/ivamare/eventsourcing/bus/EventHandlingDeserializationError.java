package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.Event;

import java.util.UUID;

/**
 * A handler could not receive an event because it could not be read in the form the handler
 * asked for. Carries the raw body instead of a usable event.
 */
public class EventHandlingDeserializationError extends EventHandlingError {

    private final String body;

    public EventHandlingDeserializationError(Throwable exception, String handlerName, UUID aggregateId,
                                             long sequenceNumber, String streamName, String eventType,
                                             String body) {
        super(exception, handlerName, null, aggregateId, sequenceNumber, streamName, eventType);
        this.body = body;
    }

    /**
     * Build from an event whose payload could not be projected.
     */
    public static EventHandlingDeserializationError of(Throwable exception, String handlerName, Event event, String body) {
        return new EventHandlingDeserializationError(exception, handlerName, event.getAggregateId(),
            event.getSequenceNumber(), event.getStreamName(), event.eventName(), body);
    }

    public String getBody() {
        return body;
    }
}
