package com.ivamare.eventsourcing.exception;

import java.util.UUID;

/**
 * Raised when a non-constructor command targets an aggregate with no events.
 */
public class AggregateNotFoundException extends EventSourcingException {

    private final String aggregateType;
    private final UUID aggregateId;

    public AggregateNotFoundException(String aggregateType, UUID aggregateId) {
        super("No " + aggregateType + " found with id " + aggregateId);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND;
    }
}
