package com.ivamare.eventsourcing.exception;

/**
 * Raised for misuse of the scheduler: unknown clocks, clocks moved backward,
 * unknown aggregate types.
 */
public class SchedulingException extends EventSourcingException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
