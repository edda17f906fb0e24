package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.ValidationReport;

/**
 * Raised when a command fails structural or state validation.
 */
public class CommandValidationException extends EventSourcingException {

    private final String commandName;
    private final ValidationReport report;

    public CommandValidationException(String commandName, ValidationReport report) {
        super("Command " + commandName + " is invalid: " + report.summary());
        this.commandName = commandName;
        this.report = report;
    }

    public String getCommandName() {
        return commandName;
    }

    public ValidationReport getReport() {
        return report;
    }

    /**
     * Whether every failure in the report was declared retryable.
     */
    public boolean isRetryable() {
        return report.isRetryable();
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }
}
