package com.ivamare.eventsourcing.exception;

/**
 * Stable external classification of failures.
 *
 * <p>Outer surfaces (HTTP endpoints, message consumers) translate failures through this
 * enum instead of depending on concrete exception types.
 */
public enum ErrorCategory {
    NOT_MODIFIED(304),
    VALIDATION(400),
    FORBIDDEN(403),
    NOT_FOUND(404),
    CONFLICT(409),
    INTERNAL(500);

    private final int statusCode;

    ErrorCategory(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Classify any throwable.
     *
     * @param ex the failure
     * @return the category, {@link #INTERNAL} for anything not raised by this library
     */
    public static ErrorCategory of(Throwable ex) {
        if (ex instanceof EventSourcingException esx) {
            return esx.category();
        }
        return INTERNAL;
    }
}
