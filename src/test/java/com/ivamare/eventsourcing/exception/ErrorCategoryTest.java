package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.ValidationFailure;
import com.ivamare.eventsourcing.model.ValidationReport;
import com.ivamare.eventsourcing.scheduler.DeliveryPrecondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorCategory")
class ErrorCategoryTest {

    @Test
    @DisplayName("should report validation failures as 400")
    void shouldClassifyValidation() {
        CommandValidationException ex = new CommandValidationException("AddItem",
            ValidationReport.of(ValidationFailure.of("quantity", "must be positive")));

        assertEquals(ErrorCategory.VALIDATION, ErrorCategory.of(ex));
        assertEquals(400, ErrorCategory.of(ex).getStatusCode());
    }

    @Test
    @DisplayName("should report authorization failures as 403")
    void shouldClassifyAuthorization() {
        assertEquals(403, ErrorCategory.of(new CommandAuthorizationException("Cancel", "jane")).getStatusCode());
    }

    @Test
    @DisplayName("should report missing aggregates and handlers as 404")
    void shouldClassifyNotFound() {
        assertEquals(ErrorCategory.NOT_FOUND, ErrorCategory.of(new AggregateNotFoundException("Order", UUID.randomUUID())));
        assertEquals(ErrorCategory.NOT_FOUND, ErrorCategory.of(new HandlerNotFoundException("Order", "GiftWrap")));
    }

    @Test
    @DisplayName("should report conflicts as 409")
    void shouldClassifyConflicts() {
        assertEquals(409, ErrorCategory.of(new ConcurrencyException("seq 3 taken")).getStatusCode());

        PreconditionNotMetException unmet =
            new PreconditionNotMetException(new DeliveryPrecondition(UUID.randomUUID(), "paid"));
        assertEquals(ErrorCategory.CONFLICT, ErrorCategory.of(unmet));
        assertEquals("paid", unmet.getPrecondition().etag());
    }

    @Test
    @DisplayName("should report anything else as 500")
    void shouldClassifyOtherFailuresAsInternal() {
        assertEquals(ErrorCategory.INTERNAL, ErrorCategory.of(new SchedulingException("Unknown clock billing")));
        assertEquals(ErrorCategory.INTERNAL, ErrorCategory.of(new IllegalStateException("boom")));
    }
}
