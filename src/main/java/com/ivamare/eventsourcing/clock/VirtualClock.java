package com.ivamare.eventsourcing.clock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A clock that only moves when told to. Never moves backward.
 */
public class VirtualClock implements Clock {

    private final AtomicReference<Instant> now;

    private VirtualClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    public static VirtualClock startingAt(Instant start) {
        return new VirtualClock(Objects.requireNonNull(start, "start"));
    }

    @Override
    public Instant now() {
        return now.get();
    }

    /**
     * @param amount non-negative amount of time to move forward
     * @return the new time
     */
    public Instant advanceBy(Duration amount) {
        if (amount.isNegative()) {
            throw new IllegalArgumentException("A virtual clock cannot be moved backward: " + amount);
        }
        return now.updateAndGet(current -> current.plus(amount));
    }

    /**
     * @param target time to move to, not before the current time
     * @return the new time
     */
    public Instant advanceTo(Instant target) {
        return now.updateAndGet(current -> {
            if (target.isBefore(current)) {
                throw new IllegalArgumentException("A virtual clock cannot be moved backward from " + current + " to " + target);
            }
            return target;
        });
    }

    @Override
    public String toString() {
        return "VirtualClock(" + now.get() + ")";
    }
}
