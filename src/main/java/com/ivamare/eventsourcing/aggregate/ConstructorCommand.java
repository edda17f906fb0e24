package com.ivamare.eventsourcing.aggregate;

import java.util.UUID;

/**
 * A command that creates its target. Applying it to an aggregate that already has events fails
 * with a {@link com.ivamare.eventsourcing.exception.ConcurrencyException}.
 *
 * @param <T> aggregate type created
 */
public abstract class ConstructorCommand<T extends EventSourcedAggregate> extends Command<T> {

    private UUID aggregateId;

    protected ConstructorCommand() {
        this(UUID.randomUUID());
    }

    protected ConstructorCommand(UUID aggregateId) {
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public void setAggregateId(UUID aggregateId) {
        this.aggregateId = aggregateId;
    }
}
