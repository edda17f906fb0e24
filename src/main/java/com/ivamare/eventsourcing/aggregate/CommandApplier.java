package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.authorization.Principal;
import com.ivamare.eventsourcing.exception.CommandAuthorizationException;
import com.ivamare.eventsourcing.exception.CommandValidationException;
import com.ivamare.eventsourcing.exception.ConcurrencyException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.model.CommandOutcome;
import com.ivamare.eventsourcing.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a command through the application pipeline:
 * <ol>
 *   <li>etag already applied: {@link CommandOutcome#NOT_MODIFIED}</li>
 *   <li>constructor command on an existing aggregate: {@link ConcurrencyException}</li>
 *   <li>{@code appliesToVersion} mismatch: {@link ConcurrencyException}</li>
 *   <li>structural validation: {@link CommandValidationException}, target untouched</li>
 *   <li>authorization: {@link CommandAuthorizationException}</li>
 *   <li>state validation: handed to {@link EventSourcedAggregate#handleCommandValidationFailure}</li>
 *   <li>enact through the registered {@link CommandHandler}</li>
 * </ol>
 */
public final class CommandApplier {

    private static final Logger log = LoggerFactory.getLogger(CommandApplier.class);

    private CommandApplier() {
    }

    public static <T extends EventSourcedAggregate> CommandOutcome apply(
            AggregateType<T> type, T target, Command<T> command, CommandContext context) {

        String commandName = command.commandName();

        if (command.getEtag() != null && target.hasETag(command.getEtag())) {
            log.debug("{}.{} with etag {} already applied to {}, skipping",
                type.name(), commandName, command.getEtag(), target.getId());
            return CommandOutcome.NOT_MODIFIED;
        }

        if (command instanceof ConstructorCommand && target.getVersion() > 0) {
            throw new ConcurrencyException(
                type.name() + " " + target.getId() + " already exists (version " + target.getVersion() + ")");
        }

        if (command.getAppliesToVersion() != null && command.getAppliesToVersion() != target.getVersion()) {
            throw new ConcurrencyException(
                commandName + " applies to version " + command.getAppliesToVersion() + " but "
                    + type.name() + " " + target.getId() + " is at version " + target.getVersion());
        }

        ValidationReport structural = command.validate();
        if (structural.hasFailures()) {
            throw new CommandValidationException(commandName, structural);
        }

        Principal principal = command.getPrincipal() != null ? command.getPrincipal() : context.principal();
        if (!context.authorizationPolicy().isAuthorized(principal, command, target)) {
            throw new CommandAuthorizationException(commandName, principal.name());
        }

        CommandHandler<T, Command<T>> handler = type.handlerFor(command);

        target.runInContext(context.withPrincipal(principal), command.getEtag(), () -> {
            ValidationReport state = command.validateAgainst(target);
            if (state.hasFailures()) {
                log.debug("{}.{} failed validation against {}: {}",
                    type.name(), commandName, target.getId(), state.summary());
                target.handleCommandValidationFailure(command, state);
                return;
            }
            handler.enactCommand(target, command);
        });

        log.debug("Applied {}.{} to {} ({} pending events)",
            type.name(), commandName, target.getId(), target.getPendingEvents().size());
        return CommandOutcome.APPLIED;
    }
}
