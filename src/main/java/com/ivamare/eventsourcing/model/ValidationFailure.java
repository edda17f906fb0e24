package com.ivamare.eventsourcing.model;

/**
 * A single failed validation rule.
 *
 * @param member command property the rule applies to, or null for whole-command rules
 * @param message human readable reason
 * @param retryable whether the rule may pass on a later attempt (e.g. a declined card charge)
 */
public record ValidationFailure(String member, String message, boolean retryable) {

    public static ValidationFailure of(String message) {
        return new ValidationFailure(null, message, false);
    }

    public static ValidationFailure of(String member, String message) {
        return new ValidationFailure(member, message, false);
    }

    public static ValidationFailure retryable(String message) {
        return new ValidationFailure(null, message, true);
    }

    @Override
    public String toString() {
        return member != null ? member + ": " + message : message;
    }
}
