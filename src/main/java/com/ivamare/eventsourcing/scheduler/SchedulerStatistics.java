package com.ivamare.eventsourcing.scheduler;

/**
 * Counts of scheduled commands on one clock.
 *
 * @param pending not yet delivered nor finalized
 * @param due pending and due at the clock's current time
 * @param delivered successfully applied
 * @param finalized cancelled or out of attempts
 */
public record SchedulerStatistics(long pending, long due, long delivered, long finalized) {
}
