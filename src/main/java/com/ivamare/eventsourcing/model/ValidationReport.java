package com.ivamare.eventsourcing.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a command: empty when the command may be enacted.
 *
 * @param failures failed rules
 */
public record ValidationReport(List<ValidationFailure> failures) {

    private static final ValidationReport VALID = new ValidationReport(List.of());

    public ValidationReport {
        failures = List.copyOf(failures);
    }

    public static ValidationReport valid() {
        return VALID;
    }

    public static ValidationReport of(ValidationFailure... failures) {
        return new ValidationReport(List.of(failures));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * True when the report has failures and every one of them is retryable.
     */
    public boolean isRetryable() {
        return !failures.isEmpty() && failures.stream().allMatch(ValidationFailure::retryable);
    }

    public String summary() {
        if (failures.isEmpty()) {
            return "valid";
        }
        return failures.stream().map(ValidationFailure::toString).collect(Collectors.joining("; "));
    }

    /**
     * Collects failures from a series of checks.
     */
    public static class Builder {

        private final List<ValidationFailure> failures = new ArrayList<>();

        public Builder check(boolean condition, String message) {
            if (!condition) {
                failures.add(ValidationFailure.of(message));
            }
            return this;
        }

        public Builder check(boolean condition, String member, String message) {
            if (!condition) {
                failures.add(ValidationFailure.of(member, message));
            }
            return this;
        }

        public Builder checkRetryable(boolean condition, String message) {
            if (!condition) {
                failures.add(ValidationFailure.retryable(message));
            }
            return this;
        }

        public Builder add(ValidationFailure failure) {
            failures.add(failure);
            return this;
        }

        public ValidationReport build() {
            return failures.isEmpty() ? VALID : new ValidationReport(failures);
        }
    }
}
