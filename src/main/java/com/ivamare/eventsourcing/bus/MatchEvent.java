package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.Event;

/**
 * Pattern over (event type name, stream name). {@code *}, empty and null match anything; the
 * base type names {@code Event} and {@code IEvent} also match any type.
 *
 * @param type event type name or {@code *}
 * @param streamName stream (aggregate type) name or {@code *}
 */
public record MatchEvent(String type, String streamName) {

    public static final String WILDCARD = "*";

    public MatchEvent {
        type = isWildcard(type) || "Event".equals(type) || "IEvent".equals(type) ? WILDCARD : type;
        streamName = isWildcard(streamName) ? WILDCARD : streamName;
    }

    public static MatchEvent any() {
        return new MatchEvent(WILDCARD, WILDCARD);
    }

    public static MatchEvent ofType(String type) {
        return new MatchEvent(type, WILDCARD);
    }

    public static MatchEvent of(String streamName, String type) {
        return new MatchEvent(type, streamName);
    }

    public boolean matches(Event event) {
        return matches(event.getStreamName(), event.eventName());
    }

    public boolean matches(String eventStreamName, String eventType) {
        boolean typeMatches = WILDCARD.equals(type) || type.equals(eventType);
        boolean streamMatches = WILDCARD.equals(streamName) || streamName.equals(eventStreamName);
        return typeMatches && streamMatches;
    }

    private static boolean isWildcard(String value) {
        return value == null || value.isBlank() || WILDCARD.equals(value);
    }

    @Override
    public String toString() {
        return streamName + "." + type;
    }
}
