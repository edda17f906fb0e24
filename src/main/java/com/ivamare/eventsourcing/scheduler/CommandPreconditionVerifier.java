package com.ivamare.eventsourcing.scheduler;

/**
 * Checks whether a delivery precondition holds.
 */
@FunctionalInterface
public interface CommandPreconditionVerifier {

    boolean isSatisfied(DeliveryPrecondition precondition);
}
