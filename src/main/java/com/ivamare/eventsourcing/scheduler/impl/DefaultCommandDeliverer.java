package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.CommandContext;
import com.ivamare.eventsourcing.aggregate.ConstructorCommand;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.authorization.AuthorizationPolicy;
import com.ivamare.eventsourcing.authorization.Principal;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.CommandAuthorizationException;
import com.ivamare.eventsourcing.exception.CommandValidationException;
import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.model.CommandOutcome;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.repository.AggregateRegistry;
import com.ivamare.eventsourcing.repository.EventSourcedRepository;
import com.ivamare.eventsourcing.scheduler.CommandDeliverer;
import com.ivamare.eventsourcing.scheduler.CommandExecutionError;
import com.ivamare.eventsourcing.scheduler.CommandFailed;
import com.ivamare.eventsourcing.scheduler.CommandPending;
import com.ivamare.eventsourcing.scheduler.CommandPreconditionVerifier;
import com.ivamare.eventsourcing.scheduler.CommandSkipped;
import com.ivamare.eventsourcing.scheduler.CommandSucceeded;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandResult;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.serialization.CommandSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Default implementation of CommandDeliverer.
 *
 * <p>One attempt:
 * <ol>
 *   <li>an unmet precondition leaves the command pending without counting an attempt</li>
 *   <li>the target is loaded (or created for a constructor command), the command applied as the
 *       system principal at the clock's time, and the target saved</li>
 *   <li>on failure the handler's failure hook runs against a freshly loaded target and may
 *       retry, cancel or record compensating events; otherwise the command type's retry policy
 *       decides</li>
 * </ol>
 * Failures never propagate: they are recorded as execution errors and returned as
 * {@link CommandFailed}.
 */
public class DefaultCommandDeliverer implements CommandDeliverer {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandDeliverer.class);

    private final AggregateRegistry aggregateRegistry;
    private final ScheduledCommandStore store;
    private final CommandSerializer commandSerializer;
    private final CommandPreconditionVerifier preconditionVerifier;
    private final RetryPolicy defaultRetryPolicy;
    private final AuthorizationPolicy authorizationPolicy;

    public DefaultCommandDeliverer(
            AggregateRegistry aggregateRegistry,
            ScheduledCommandStore store,
            CommandSerializer commandSerializer,
            CommandPreconditionVerifier preconditionVerifier,
            RetryPolicy defaultRetryPolicy,
            AuthorizationPolicy authorizationPolicy) {
        this.aggregateRegistry = aggregateRegistry;
        this.store = store;
        this.commandSerializer = commandSerializer;
        this.preconditionVerifier = preconditionVerifier;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.authorizationPolicy = authorizationPolicy;
    }

    @Override
    public ScheduledCommandResult deliver(ScheduledCommand scheduled, Instant now) {
        if (!scheduled.isPending()) {
            log.debug("Skipping {}: already {}", scheduled, scheduled.isDelivered() ? "delivered" : "finalized");
            return new CommandSkipped(scheduled);
        }
        if (scheduled.precondition() != null && !preconditionVerifier.isSatisfied(scheduled.precondition())) {
            log.debug("Holding {}: waiting for {}", scheduled, scheduled.precondition());
            return new CommandPending(scheduled, CommandPending.Reason.PRECONDITION_NOT_MET);
        }
        AggregateRegistry.Registration<?> registration = aggregateRegistry.getOrThrow(scheduled.aggregateType());
        return deliverTo(registration, scheduled, now);
    }

    private <T extends EventSourcedAggregate> ScheduledCommandResult deliverTo(
            AggregateRegistry.Registration<T> registration, ScheduledCommand scheduled, Instant now) {
        AggregateType<T> type = registration.type();
        EventSourcedRepository<T> repository = registration.repository();
        CommandContext context = new CommandContext(Clock.fixed(now), Principal.system(), authorizationPolicy);

        Command<T> command = null;
        boolean targetExisted = false;
        try {
            command = commandSerializer.deserialize(type, scheduled.commandName(), scheduled.serializedCommand());
            Optional<T> existing = repository.getLatest(scheduled.aggregateId());
            targetExisted = existing.isPresent();
            T target;
            if (targetExisted) {
                target = existing.get();
            } else if (command instanceof ConstructorCommand) {
                target = type.newInstance(scheduled.aggregateId());
            } else {
                throw new AggregateNotFoundException(type.name(), scheduled.aggregateId());
            }

            CommandOutcome outcome = type.apply(target, command, context);
            repository.save(target);

            store.update(scheduled.recordSuccess(now));
            log.info("Delivered {}.{} to {} (seq={}, attempt={}, outcome={})",
                type.name(), scheduled.commandName(), scheduled.aggregateId(),
                scheduled.sequenceNumber(), scheduled.attempts() + 1, outcome);
            return new CommandSucceeded(scheduled, outcome);
        } catch (RuntimeException e) {
            return handleFailure(registration, scheduled, command, targetExisted, e, now, context);
        }
    }

    private <T extends EventSourcedAggregate> CommandFailed<Command<T>> handleFailure(
            AggregateRegistry.Registration<T> registration, ScheduledCommand scheduled, Command<T> command,
            boolean targetExisted, RuntimeException exception, Instant now, CommandContext context) {
        CommandFailed<Command<T>> failure = new CommandFailed<>(scheduled, command, exception, scheduled.attempts());
        int attempt = scheduled.attempts() + 1;

        boolean redundantConstructor = exception instanceof ConcurrencyException
            && command instanceof ConstructorCommand
            && (targetExisted || registration.repository().getLatest(scheduled.aggregateId()).isPresent());

        if (redundantConstructor) {
            log.info("Cancelling {}: target {} already exists", scheduled, scheduled.aggregateId());
            failure.cancel();
        } else {
            if (command != null) {
                runFailureHook(registration, command, failure, context);
            }
            if (exception instanceof CommandAuthorizationException) {
                failure.cancel();
            } else if (!failure.isDecided()) {
                applyRetryPolicy(registration.type(), scheduled, exception, attempt, failure);
            }
        }

        Duration retryAfter = failure.isCanceled() ? null : failure.getRetryAfter().orElse(null);
        ScheduledCommand updated = scheduled.recordFailure(now, retryAfter);
        store.update(updated);
        store.addError(new CommandExecutionError(
            scheduled.aggregateId(),
            scheduled.sequenceNumber(),
            attempt,
            now,
            exception.getClass().getName(),
            exception.getMessage(),
            updated.isFinal()
        ));

        if (updated.isFinal()) {
            log.warn("Scheduled command {} failed on attempt {} and will not be retried{}: {}",
                scheduled, attempt, failure.isCanceled() ? " (cancelled)" : "", exception.getMessage());
        } else {
            log.info("Scheduled command {} failed on attempt {}, retrying at {}: {}",
                scheduled, attempt, updated.dueTime(), exception.getMessage());
        }
        return failure;
    }

    private void applyRetryPolicy(AggregateType<?> type, ScheduledCommand scheduled, RuntimeException exception,
                                  int attempt, CommandFailed<?> failure) {
        if (!isRetryable(exception)) {
            return;
        }
        RetryPolicy policy = type.retryPolicyFor(scheduled.commandName()).orElse(defaultRetryPolicy);
        if (!policy.shouldRetry(attempt)) {
            return;
        }
        if (exception instanceof ConcurrencyException) {
            failure.retry();
        } else {
            failure.retry(policy.getBackoff(attempt));
        }
    }

    private static boolean isRetryable(RuntimeException exception) {
        if (exception instanceof CommandValidationException validation) {
            return validation.isRetryable();
        }
        return !(exception instanceof EventSerializationException)
            && !(exception instanceof HandlerNotFoundException);
    }

    private <T extends EventSourcedAggregate> void runFailureHook(
            AggregateRegistry.Registration<T> registration, Command<T> command,
            CommandFailed<Command<T>> failure, CommandContext context) {
        AggregateType<T> type = registration.type();
        EventSourcedRepository<T> repository = registration.repository();
        ScheduledCommand scheduled = failure.scheduledCommand();
        try {
            Optional<T> fresh = repository.getLatest(scheduled.aggregateId());
            if (fresh.isEmpty()) {
                return;
            }
            T target = fresh.get();
            CommandHandler<T, Command<T>> handler = type.handlerFor(command);
            target.runInContext(context, null, () -> handler.handleScheduledCommandException(target, failure));
            if (target.hasPendingEvents()) {
                repository.save(target);
            }
        } catch (ConcurrencyException e) {
            log.warn("Events recorded by the failure handler of {} lost a concurrent write: {}",
                scheduled, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failure handler of {} threw", scheduled, e);
        }
    }
}
