package com.ivamare.eventsourcing.scheduler;

import java.util.Objects;
import java.util.UUID;

/**
 * Delivery of a scheduled command waits until an event carrying {@code etag} has been recorded
 * for {@code aggregateId}.
 *
 * @param aggregateId aggregate the event must belong to
 * @param etag etag of the event
 */
public record DeliveryPrecondition(UUID aggregateId, String etag) {

    public DeliveryPrecondition {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(etag, "etag");
    }

    public static DeliveryPrecondition eventHasBeenRecorded(UUID aggregateId, String etag) {
        return new DeliveryPrecondition(aggregateId, etag);
    }

    @Override
    public String toString() {
        return "event with etag " + etag + " recorded on " + aggregateId;
    }
}
