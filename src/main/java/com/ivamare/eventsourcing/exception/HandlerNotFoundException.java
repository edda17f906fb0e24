package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no handler is registered for a command.
 */
public class HandlerNotFoundException extends EventSourcingException {

    private final String aggregateType;
    private final String commandName;

    public HandlerNotFoundException(String aggregateType, String commandName) {
        super("No handler registered for " + aggregateType + "." + commandName);
        this.aggregateType = aggregateType;
        this.commandName = commandName;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getCommandName() {
        return commandName;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND;
    }
}
