package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandWakeupSender;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wakes up delivery of each stored command at {@code dueTime - wakeupOffset} on an in-process
 * timer. Meant for clocks that follow wall time: on wake-up the command's clock is caught up to
 * wall time before the command is delivered.
 */
public class ExecutorWakeupSender implements ScheduledCommandWakeupSender, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorWakeupSender.class);

    private final ScheduledExecutorService executor;
    private final SchedulerClockTrigger trigger;
    private final Clock wallClock;
    private final Duration wakeupOffset;
    private final boolean ownsExecutor;

    public ExecutorWakeupSender(SchedulerClockTrigger trigger, Clock wallClock, Duration wakeupOffset) {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "scheduler-wakeup");
            thread.setDaemon(true);
            return thread;
        }), trigger, wallClock, wakeupOffset, true);
    }

    public ExecutorWakeupSender(ScheduledExecutorService executor, SchedulerClockTrigger trigger,
                                Clock wallClock, Duration wakeupOffset) {
        this(executor, trigger, wallClock, wakeupOffset, false);
    }

    private ExecutorWakeupSender(ScheduledExecutorService executor, SchedulerClockTrigger trigger,
                                 Clock wallClock, Duration wakeupOffset, boolean ownsExecutor) {
        this.executor = executor;
        this.trigger = trigger;
        this.wallClock = wallClock;
        this.wakeupOffset = wakeupOffset != null ? wakeupOffset : Duration.ZERO;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public void commandScheduled(ScheduledCommand command) {
        if (command.dueTime() == null) {
            return;
        }
        long delayMs = Math.max(0, Duration.between(wallClock.now(), command.dueTime().minus(wakeupOffset)).toMillis());
        executor.schedule(() -> wakeUp(command), delayMs, TimeUnit.MILLISECONDS);
        log.debug("Wake-up for {} in {}ms", command, delayMs);
    }

    void wakeUp(ScheduledCommand command) {
        try {
            Instant now = wallClock.now();
            trigger.catchUp(command.clockName(), now);
            trigger.deliver(command.aggregateId(), command.sequenceNumber());
        } catch (RuntimeException e) {
            log.warn("Wake-up for {} failed, the worker will pick it up: {}", command, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
