package com.ivamare.eventsourcing.exception;

/**
 * Raised when an event or command cannot be written to or read from its JSON envelope.
 */
public class EventSerializationException extends EventSourcingException {

    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
