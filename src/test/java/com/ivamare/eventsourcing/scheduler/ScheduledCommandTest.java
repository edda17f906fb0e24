package com.ivamare.eventsourcing.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScheduledCommand")
class ScheduledCommandTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private ScheduledCommand command(Instant due) {
        return new ScheduledCommand(UUID.randomUUID(), 3, "Order", "Ship", "{}", "e",
            START, due, null, null, 0, "default", null);
    }

    @Test
    @DisplayName("should be due once the clock reaches the due time")
    void shouldBeDueAtDueTime() {
        ScheduledCommand command = command(START.plusSeconds(5));

        assertFalse(command.isDue(START.plusSeconds(4)));
        assertTrue(command.isDue(START.plusSeconds(5)));
    }

    @Test
    @DisplayName("should always be due without a due time")
    void shouldAlwaysBeDueWithoutDueTime() {
        assertTrue(command(null).isDue(START.minusSeconds(60)));
    }

    @Test
    @DisplayName("should never be due once delivered")
    void shouldNeverBeDueOnceDelivered() {
        ScheduledCommand delivered = command(null).recordSuccess(START);

        assertTrue(delivered.isDelivered());
        assertFalse(delivered.isPending());
        assertFalse(delivered.isDue(START.plusSeconds(60)));
        assertEquals(1, delivered.attempts());
    }

    @Test
    @DisplayName("should finalize a failure without retry")
    void shouldFinalizeFailureWithoutRetry() {
        ScheduledCommand failed = command(START).recordFailure(START.plusSeconds(1), null);

        assertTrue(failed.isFinal());
        assertEquals(START.plusSeconds(1), failed.finalAttemptTime());
        assertEquals(START, failed.dueTime());
    }

    @Test
    @DisplayName("should reschedule a failure with retry")
    void shouldRescheduleFailureWithRetry() {
        ScheduledCommand failed = command(START).recordFailure(START.plusSeconds(1), Duration.ofMinutes(1));

        assertTrue(failed.isPending());
        assertEquals(START.plusSeconds(61), failed.dueTime());
    }
}
