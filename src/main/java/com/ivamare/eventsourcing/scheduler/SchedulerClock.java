package com.ivamare.eventsourcing.scheduler;

import java.time.Instant;

/**
 * A named, persisted logical clock scheduled commands are evaluated against.
 *
 * @param name unique clock name
 * @param startTime time the clock was created at
 * @param utcNow the clock's current time
 */
public record SchedulerClock(String name, Instant startTime, Instant utcNow) {

    public SchedulerClock withUtcNow(Instant now) {
        return new SchedulerClock(name, startTime, now);
    }
}
