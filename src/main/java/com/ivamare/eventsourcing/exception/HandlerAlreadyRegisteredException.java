package com.ivamare.eventsourcing.exception;

/**
 * Thrown when attempting to register a handler for a command that already has one.
 */
public class HandlerAlreadyRegisteredException extends EventSourcingException {

    private final String aggregateType;
    private final String commandName;

    public HandlerAlreadyRegisteredException(String aggregateType, String commandName) {
        super("Handler already registered for " + aggregateType + "." + commandName);
        this.aggregateType = aggregateType;
        this.commandName = commandName;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getCommandName() {
        return commandName;
    }
}
