package com.ivamare.eventsourcing.exception;

/**
 * Raised when the authorization policy denies a command. Never retried.
 */
public class CommandAuthorizationException extends EventSourcingException {

    private final String commandName;
    private final String principal;

    public CommandAuthorizationException(String commandName, String principal) {
        super("Principal '" + principal + "' is not authorized to apply " + commandName);
        this.commandName = commandName;
        this.principal = principal;
    }

    public String getCommandName() {
        return commandName;
    }

    public String getPrincipal() {
        return principal;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.FORBIDDEN;
    }
}
