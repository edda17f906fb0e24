package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.scheduler.DeliveryPrecondition;

/**
 * Raised when a scheduled command is forced through while its delivery
 * precondition is still unsatisfied.
 */
public class PreconditionNotMetException extends EventSourcingException {

    private final DeliveryPrecondition precondition;

    public PreconditionNotMetException(DeliveryPrecondition precondition) {
        super("Precondition not met: " + precondition);
        this.precondition = precondition;
    }

    public DeliveryPrecondition getPrecondition() {
        return precondition;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
