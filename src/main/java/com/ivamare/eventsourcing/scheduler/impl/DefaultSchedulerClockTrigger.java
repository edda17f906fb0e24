package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.exception.SchedulingException;
import com.ivamare.eventsourcing.scheduler.CommandDeliverer;
import com.ivamare.eventsourcing.scheduler.CommandFailed;
import com.ivamare.eventsourcing.scheduler.CommandPending;
import com.ivamare.eventsourcing.scheduler.CommandSucceeded;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandResult;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.SchedulerAdvancedResult;
import com.ivamare.eventsourcing.scheduler.SchedulerClock;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of SchedulerClockTrigger. Advances of the same clock are serialized, and
 * each stored command is delivered by at most one thread at a time.
 */
public class DefaultSchedulerClockTrigger implements SchedulerClockTrigger {

    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulerClockTrigger.class);

    private final ScheduledCommandStore store;
    private final CommandDeliverer deliverer;
    private final Map<String, ReentrantLock> clockLocks = new ConcurrentHashMap<>();
    private final Set<String> inDelivery = ConcurrentHashMap.newKeySet();

    public DefaultSchedulerClockTrigger(ScheduledCommandStore store, CommandDeliverer deliverer) {
        this.store = store;
        this.deliverer = deliverer;
    }

    @Override
    public SchedulerAdvancedResult advanceClock(String clockName, Duration by) {
        if (by.isNegative()) {
            throw new SchedulingException("Cannot move clock " + clockName + " backward by " + by);
        }
        ReentrantLock lock = lockFor(clockName);
        lock.lock();
        try {
            SchedulerClock clock = requireClock(clockName);
            return advance(clock, clock.utcNow().plus(by));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SchedulerAdvancedResult advanceClock(String clockName, Instant to) {
        ReentrantLock lock = lockFor(clockName);
        lock.lock();
        try {
            SchedulerClock clock = requireClock(clockName);
            if (to.isBefore(clock.utcNow())) {
                throw new SchedulingException("Cannot move clock " + clockName + " backward from "
                    + clock.utcNow() + " to " + to);
            }
            return advance(clock, to);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SchedulerAdvancedResult catchUp(String clockName, Instant now) {
        ReentrantLock lock = lockFor(clockName);
        lock.lock();
        try {
            SchedulerClock clock = store.getOrCreateClock(clockName, now);
            Instant target = now.isAfter(clock.utcNow()) ? now : clock.utcNow();
            return advance(clock, target);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScheduledCommandResult> deliver(UUID aggregateId, long sequenceNumber) {
        Optional<ScheduledCommand> found = store.find(aggregateId, sequenceNumber);
        if (found.isEmpty()) {
            log.debug("No scheduled command {}:{}", aggregateId, sequenceNumber);
            return Optional.empty();
        }
        ScheduledCommand command = found.get();
        Instant now = requireClock(command.clockName()).utcNow();
        if (command.isPending() && !command.isDue(now)) {
            return Optional.of(new CommandPending(command, CommandPending.Reason.NOT_DUE));
        }
        return Optional.of(deliverClaimed(command, now));
    }

    /**
     * Deliver {@code command} unless another thread is delivering it right now. Never waits, so a
     * delivery that schedules further commands on a bus thread cannot deadlock with its caller.
     */
    private ScheduledCommandResult deliverClaimed(ScheduledCommand command, Instant now) {
        String key = command.aggregateId() + ":" + command.sequenceNumber();
        if (!inDelivery.add(key)) {
            log.debug("{} is already being delivered", command);
            return new CommandPending(command, CommandPending.Reason.IN_DELIVERY);
        }
        try {
            // re-read after claiming, another thread may have delivered it meanwhile
            ScheduledCommand current = store.find(command.aggregateId(), command.sequenceNumber()).orElse(command);
            return deliverer.deliver(current, now);
        } finally {
            inDelivery.remove(key);
        }
    }

    private SchedulerAdvancedResult advance(SchedulerClock clock, Instant to) {
        if (to.isAfter(clock.utcNow())) {
            store.updateClock(clock.withUtcNow(to));
            log.debug("Advanced clock {} from {} to {}", clock.name(), clock.utcNow(), to);
        }

        List<ScheduledCommand> due = store.findDue(clock.name(), to);
        if (due.isEmpty()) {
            return SchedulerAdvancedResult.empty(clock.name(), to);
        }

        List<CommandSucceeded> succeeded = new ArrayList<>();
        List<CommandFailed<?>> failed = new ArrayList<>();
        List<CommandPending> pending = new ArrayList<>();
        for (ScheduledCommand command : due) {
            ScheduledCommandResult result = deliverClaimed(command, to);
            if (result instanceof CommandSucceeded success) {
                succeeded.add(success);
            } else if (result instanceof CommandFailed<?> failure) {
                failed.add(failure);
            } else if (result instanceof CommandPending waiting) {
                pending.add(waiting);
            }
        }
        log.info("Clock {} at {}: {} delivered, {} failed, {} waiting on preconditions",
            clock.name(), to, succeeded.size(), failed.size(), pending.size());
        return new SchedulerAdvancedResult(clock.name(), to, succeeded, failed, pending);
    }

    private SchedulerClock requireClock(String clockName) {
        return store.findClock(clockName)
            .orElseThrow(() -> new SchedulingException("Unknown clock " + clockName));
    }

    private ReentrantLock lockFor(String clockName) {
        return clockLocks.computeIfAbsent(clockName, name -> new ReentrantLock());
    }
}
