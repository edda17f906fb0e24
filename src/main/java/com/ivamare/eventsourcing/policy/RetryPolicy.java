package com.ivamare.eventsourcing.policy;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Default retry decision for scheduled commands that fail without their handler calling
 * {@code retry} or {@code cancel}.
 *
 * @param maxAttempts Maximum number of delivery attempts before the command is finalized
 * @param backoffSchedule Delay before each retry, indexed by the attempt that failed
 */
public record RetryPolicy(
    int maxAttempts,
    List<Duration> backoffSchedule
) {
    private static final Duration FALLBACK_BACKOFF = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        backoffSchedule = List.copyOf(backoffSchedule);
    }

    /**
     * Default retry policy: 5 attempts, one more minute of back-off after each failure.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return ofSeconds(5, List.of(60, 120, 180, 240, 300));
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of());
    }

    public static RetryPolicy of(int maxAttempts, Duration... backoffSchedule) {
        return new RetryPolicy(maxAttempts, Arrays.asList(backoffSchedule));
    }

    /**
     * @param maxAttempts Maximum number of attempts
     * @param backoffSeconds Back-off schedule in seconds
     * @return the policy
     */
    public static RetryPolicy ofSeconds(int maxAttempts, List<Integer> backoffSeconds) {
        return new RetryPolicy(maxAttempts, backoffSeconds.stream().map(Duration::ofSeconds).toList());
    }

    /**
     * Get the back-off before retrying after a failed attempt.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay before the next attempt, zero when no attempts remain
     */
    public Duration getBackoff(int attempt) {
        if (attempt >= maxAttempts) {
            return Duration.ZERO;
        }

        int index = attempt - 1;
        if (index < 0) {
            return backoffSchedule.isEmpty() ? FALLBACK_BACKOFF : backoffSchedule.get(0);
        }

        if (index < backoffSchedule.size()) {
            return backoffSchedule.get(index);
        }

        // Last value for attempts beyond schedule
        return backoffSchedule.isEmpty() ? FALLBACK_BACKOFF : backoffSchedule.get(backoffSchedule.size() - 1);
    }

    /**
     * Check if another attempt should be made.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
