package com.ivamare.eventsourcing.clock;

import java.time.Instant;

/**
 * Source of the current time, passed explicitly to everything that stamps or compares times.
 */
@FunctionalInterface
public interface Clock {

    Instant now();

    /**
     * A clock frozen at {@code instant}.
     */
    static Clock fixed(Instant instant) {
        return () -> instant;
    }

    static Clock system() {
        return SystemClock.INSTANCE;
    }
}
