package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.scheduler.CommandPreconditionVerifier;
import com.ivamare.eventsourcing.scheduler.DeliveryPrecondition;
import com.ivamare.eventsourcing.store.EventStream;

/**
 * A precondition holds once the event stream contains an event with the required etag.
 */
public class EventStreamPreconditionVerifier implements CommandPreconditionVerifier {

    private final EventStream eventStream;

    public EventStreamPreconditionVerifier(EventStream eventStream) {
        this.eventStream = eventStream;
    }

    @Override
    public boolean isSatisfied(DeliveryPrecondition precondition) {
        return eventStream.hasETag(precondition.aggregateId(), precondition.etag());
    }
}
