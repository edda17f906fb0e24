package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;

/**
 * Raised when a write loses the optimistic concurrency race on
 * (aggregateId, sequenceNumber), or when a constructor command targets an
 * aggregate that already exists.
 *
 * <p>Recoverable by reloading the aggregate and applying the command again.
 */
public class ConcurrencyException extends EventSourcingException {

    private final List<Event> events;

    public ConcurrencyException(String message) {
        this(message, List.of(), null);
    }

    public ConcurrencyException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ConcurrencyException(String message, List<? extends Event> events, Throwable cause) {
        super(message, cause);
        this.events = events != null ? List.copyOf(events) : List.of();
    }

    /**
     * The events that were rejected by storage.
     */
    public List<Event> getEvents() {
        return events;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
