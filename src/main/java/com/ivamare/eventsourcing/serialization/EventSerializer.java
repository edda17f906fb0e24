package com.ivamare.eventsourcing.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.model.DynamicEvent;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts events to and from their {@link StoredEvent} envelope.
 *
 * <p>Reading is lenient: an unknown type name or a body that does not fit the registered class
 * yields no event, and properties the class does not declare are ignored.
 */
public class EventSerializer {

    private static final Logger log = LoggerFactory.getLogger(EventSerializer.class);

    private final ObjectMapper objectMapper;

    public EventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper configured the way stored bodies are written and read.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // JSR310
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return mapper;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Build the storage envelope. The event must already carry aggregate id and sequence number.
     */
    public StoredEvent toStoredEvent(Event event) {
        return new StoredEvent(
            event.getAggregateId(),
            event.getSequenceNumber(),
            event.getStreamName(),
            event.eventName(),
            serializeBody(event),
            event.getTimestamp(),
            event.getEtag(),
            event.getActor(),
            event.getAbsoluteSequenceNumber()
        );
    }

    public String serializeBody(Event event) {
        if (event instanceof DynamicEvent dynamic) {
            return dynamic.getBody().toString();
        }
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize " + event.eventName(), e);
        }
    }

    /**
     * Read an event registered on {@code type}.
     *
     * @return the event, or empty if its type is unknown or its body is unreadable
     */
    public Optional<Event> deserialize(StoredEvent stored, AggregateType<?> type) {
        Optional<Class<? extends Event>> eventClass = type.eventClass(stored.type());
        if (eventClass.isEmpty()) {
            log.debug("Skipping {} {} seq={}: unknown event type {}",
                type.name(), stored.aggregateId(), stored.sequenceNumber(), stored.type());
            return Optional.empty();
        }
        try {
            Event event = objectMapper.readValue(stored.body(), eventClass.get());
            event.applyMetadata(stored);
            return Optional.of(event);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable {} event {} seq={}: {}",
                stored.type(), stored.aggregateId(), stored.sequenceNumber(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Read any stored event without knowing its class.
     */
    public DynamicEvent toDynamic(StoredEvent stored) {
        try {
            DynamicEvent event = new DynamicEvent(stored.type(), objectMapper.readTree(stored.body()));
            event.applyMetadata(stored);
            return event;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Unreadable body for " + stored.type(), e);
        }
    }

    /**
     * View a typed event as a {@link DynamicEvent}, keeping its metadata.
     */
    public DynamicEvent toDynamic(Event event) {
        if (event instanceof DynamicEvent dynamic) {
            return dynamic;
        }
        DynamicEvent dynamic = new DynamicEvent(event.eventName(), objectMapper.valueToTree(event));
        copyMetadata(event, dynamic);
        return dynamic;
    }

    /**
     * Re-read the payload of {@code event} as {@code shape}, ignoring properties the shape does
     * not declare.
     *
     * @throws EventSerializationException if the payload cannot be mapped onto the shape
     */
    public <S> S project(Event event, Class<S> shape) {
        JsonNode tree = event instanceof DynamicEvent dynamic
            ? dynamic.getBody()
            : objectMapper.valueToTree(event);
        try {
            S projected = objectMapper.treeToValue(tree, shape);
            if (projected instanceof Event target) {
                copyMetadata(event, target);
            }
            return projected;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException(
                "Cannot project " + event.eventName() + " onto " + shape.getSimpleName(), e);
        }
    }

    private static void copyMetadata(Event source, Event target) {
        target.setAggregateId(source.getAggregateId());
        target.setSequenceNumber(source.getSequenceNumber());
        target.setTimestamp(source.getTimestamp());
        target.setActor(source.getActor());
        target.setEtag(source.getEtag());
        target.setStreamName(source.getStreamName());
        target.setAbsoluteSequenceNumber(source.getAbsoluteSequenceNumber());
    }
}
