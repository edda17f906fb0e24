package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.authorization.AuthorizationPolicy;
import com.ivamare.eventsourcing.exception.CommandAuthorizationException;
import com.ivamare.eventsourcing.exception.CommandValidationException;
import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.scheduler.CommandExecutionError;
import com.ivamare.eventsourcing.scheduler.CommandFailed;
import com.ivamare.eventsourcing.scheduler.CommandSkipped;
import com.ivamare.eventsourcing.scheduler.CommandSucceeded;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandResult;
import com.ivamare.eventsourcing.scheduler.SchedulerAdvancedResult;
import com.ivamare.eventsourcing.support.EventSourcingFixture;
import com.ivamare.eventsourcing.testdomain.Order;
import com.ivamare.eventsourcing.testdomain.PaymentGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.ivamare.eventsourcing.support.EventSourcingFixture.CLOCK;
import static com.ivamare.eventsourcing.support.EventSourcingFixture.START;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultCommandDeliverer")
class DefaultCommandDelivererTest {

    private EventSourcingFixture fixture;
    private UUID orderId;

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ScheduledCommand stored(ScheduledCommandResult result) {
        ScheduledCommand command = result.scheduledCommand();
        return fixture.commandStore.find(command.aggregateId(), command.sequenceNumber()).orElseThrow();
    }

    private Order order() {
        return fixture.repository(Order.class).getLatest(orderId).orElseThrow();
    }

    @Nested
    @DisplayName("failure handler")
    class FailureHandlerTests {

        private PaymentGateway.Declining gateway;

        @BeforeEach
        void setUp() {
            gateway = new PaymentGateway.Declining();
            fixture = new EventSourcingFixture();
            fixture.register(Order.type(gateway));
            orderId = UUID.randomUUID();
            fixture.execute(Order.TYPE, orderId, new Order.CreateOrder(orderId, "Waylon Jennings"));
        }

        @Test
        @DisplayName("should retry declined charges daily and cancel the order after the third decline")
        void shouldRetryDailyThenCancel() {
            ScheduledCommandResult first = fixture.scheduler.schedule(
                Order.TYPE, orderId, new Order.ChargeCreditCard(new BigDecimal("25.00")));

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, first);
            assertTrue(failure.willBeRetried());
            assertEquals(Duration.ofDays(1), failure.getRetryAfter().orElseThrow());
            assertEquals(START.plus(Duration.ofDays(1)), stored(first).dueTime());

            SchedulerAdvancedResult second = fixture.trigger.advanceClock(CLOCK, Duration.ofDays(1));
            assertEquals(1, second.failedCommands().size());
            assertEquals(1, second.failedCommands().get(0).getNumberOfPreviousAttempts());
            assertFalse(order().isCancelled());

            SchedulerAdvancedResult third = fixture.trigger.advanceClock(CLOCK, Duration.ofDays(1));
            assertTrue(third.failedCommands().get(0).isCanceled());

            assertEquals(3, gateway.calls());
            Order order = order();
            assertTrue(order.isCancelled());
            assertEquals("Payment declined", order.getCancellationReason());

            ScheduledCommand row = stored(first);
            assertTrue(row.isFinal());
            assertEquals(3, row.attempts());

            List<CommandExecutionError> errors = fixture.commandStore.errors(orderId, row.sequenceNumber());
            assertEquals(3, errors.size());
            assertEquals(IllegalStateException.class.getName(), errors.get(0).exceptionType());
            assertFalse(errors.get(1).finalAttempt());
            assertTrue(errors.get(2).finalAttempt());

            assertEquals(0, fixture.trigger.advanceClock(CLOCK, Duration.ofDays(1)).deliveredCount());
            assertEquals(3, gateway.calls());
        }

        @Test
        @DisplayName("should record compensating events as the system principal")
        void shouldRecordCompensatingEventsAsSystem() {
            fixture.scheduler.schedule(Order.TYPE, orderId, new Order.ChargeCreditCard(BigDecimal.TEN));
            fixture.trigger.advanceClock(CLOCK, Duration.ofDays(1));
            fixture.trigger.advanceClock(CLOCK, Duration.ofDays(1));

            assertEquals("Cancelled", fixture.eventStream.latest(orderId).orElseThrow().type());
            assertEquals("system", fixture.eventStream.latest(orderId).orElseThrow().actor());
            assertEquals(START.plus(Duration.ofDays(2)), fixture.eventStream.latest(orderId).orElseThrow().timestamp());
        }
    }

    @Nested
    @DisplayName("retry policy")
    class RetryPolicyTests {

        @BeforeEach
        void setUp() {
            fixture = new EventSourcingFixture();
            fixture.register(Order.TYPE);
            orderId = UUID.randomUUID();
            fixture.execute(Order.TYPE, orderId, new Order.CreateOrder(orderId, "Waylon Jennings"));
        }

        @Test
        @DisplayName("should retry immediately after a concurrency conflict")
        void shouldRetryImmediatelyAfterConcurrencyConflict() {
            Order.AddItem addItem = new Order.AddItem("Guitar", 1);
            addItem.setAppliesToVersion(0L);

            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, orderId, addItem);

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertInstanceOf(ConcurrencyException.class, failure.getException());
            assertEquals(Duration.ZERO, failure.getRetryAfter().orElseThrow());
            ScheduledCommand row = stored(result);
            assertTrue(row.isPending());
            assertEquals(START, row.dueTime());

            fixture.trigger.advanceClock(CLOCK, Duration.ZERO);
            assertEquals(2, stored(result).attempts());
        }

        @Test
        @DisplayName("should retry a retryable validation failure with the default back-off")
        void shouldRetryRetryableValidationFailure() {
            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, orderId, new Order.Ship());

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertInstanceOf(CommandValidationException.class, failure.getException());
            assertEquals(START.plusSeconds(60), stored(result).dueTime());

            fixture.execute(Order.TYPE, orderId, new Order.AddItem("Guitar", 1));
            SchedulerAdvancedResult retried = fixture.trigger.advanceClock(CLOCK, Duration.ofSeconds(60));

            assertEquals(1, retried.successfulCommands().size());
            assertTrue(order().isShipped());
        }

        @Test
        @DisplayName("should finalize a non-retryable validation failure after one attempt")
        void shouldFinalizeNonRetryableValidationFailure() {
            fixture.execute(Order.TYPE, orderId, new Order.Cancel("changed my mind"));

            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, orderId, new Order.AddItem("Guitar", 1));

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertFalse(failure.willBeRetried());
            ScheduledCommand row = stored(result);
            assertTrue(row.isFinal());
            assertEquals(1, row.attempts());
        }

        @Test
        @DisplayName("should give up once the policy runs out of attempts")
        void shouldGiveUpWhenAttemptsExhausted() {
            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, orderId, new Order.Ship());

            for (int i = 0; i < 10; i++) {
                fixture.trigger.advanceClock(CLOCK, Duration.ofMinutes(5));
            }

            ScheduledCommand row = stored(result);
            assertTrue(row.isFinal());
            assertEquals(RetryPolicy.defaultPolicy().maxAttempts(), row.attempts());
            assertEquals(row.attempts(), fixture.commandStore.errors(orderId, row.sequenceNumber()).size());
        }

        @Test
        @DisplayName("should retry a command whose target does not exist yet")
        void shouldRetryCommandForMissingTarget() {
            UUID unknown = UUID.randomUUID();

            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, unknown, new Order.AddItem("Guitar", 1));

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertTrue(failure.willBeRetried());
        }
    }

    @Nested
    @DisplayName("terminal outcomes")
    class TerminalOutcomeTests {

        @BeforeEach
        void setUp() {
            fixture = new EventSourcingFixture();
            fixture.register(Order.TYPE);
            orderId = UUID.randomUUID();
            fixture.execute(Order.TYPE, orderId, new Order.CreateOrder(orderId, "Waylon Jennings"));
        }

        @Test
        @DisplayName("should create the target of a constructor command")
        void shouldCreateTargetOfConstructorCommand() {
            UUID newOrder = UUID.randomUUID();

            ScheduledCommandResult result = fixture.scheduler.schedule(
                Order.TYPE, newOrder, new Order.CreateOrder(newOrder, "Willie Nelson"));

            assertInstanceOf(CommandSucceeded.class, result);
            assertEquals("Willie Nelson",
                fixture.repository(Order.class).getLatest(newOrder).orElseThrow().getCustomerName());
        }

        @Test
        @DisplayName("should cancel a constructor command whose target already exists")
        void shouldCancelRedundantConstructorCommand() {
            ScheduledCommandResult result = fixture.scheduler.schedule(
                Order.TYPE, orderId, new Order.CreateOrder(orderId, "Willie Nelson"));

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertTrue(failure.isCanceled());
            assertTrue(stored(result).isFinal());
            assertEquals("Waylon Jennings", order().getCustomerName());
        }

        @Test
        @DisplayName("should cancel a command the principal may not apply")
        void shouldCancelUnauthorizedCommand() {
            DefaultCommandDeliverer strict = new DefaultCommandDeliverer(
                fixture.aggregateRegistry,
                fixture.commandStore,
                fixture.commandSerializer,
                new EventStreamPreconditionVerifier(fixture.eventStream),
                RetryPolicy.defaultPolicy(),
                AuthorizationPolicy.denyAll());
            ScheduledCommandResult pending = fixture.scheduler.schedule(
                Order.TYPE, orderId, new Order.AddItem("Guitar", 1), START.plusSeconds(60));

            ScheduledCommandResult result = strict.deliver(stored(pending), START.plusSeconds(60));

            CommandFailed<?> failure = assertInstanceOf(CommandFailed.class, result);
            assertInstanceOf(CommandAuthorizationException.class, failure.getException());
            assertTrue(failure.isCanceled());
            assertTrue(stored(pending).isFinal());
        }

        @Test
        @DisplayName("should skip a command that was already delivered")
        void shouldSkipDeliveredCommand() {
            ScheduledCommandResult result = fixture.scheduler.schedule(Order.TYPE, orderId, new Order.AddItem("Guitar", 1));

            ScheduledCommandResult again = fixture.deliverer.deliver(stored(result), START);

            assertInstanceOf(CommandSkipped.class, again);
            assertEquals(1, order().quantityOf("Guitar"));
        }
    }
}
