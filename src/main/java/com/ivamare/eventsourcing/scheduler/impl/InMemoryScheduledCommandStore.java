package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.scheduler.CommandExecutionError;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.SchedulerClock;
import com.ivamare.eventsourcing.scheduler.SchedulerStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Scheduled command store held in memory. Used in tests and when no database is configured.
 */
public class InMemoryScheduledCommandStore implements ScheduledCommandStore {

    // direct commands count down from -1, so the magnitude follows scheduling order
    static final Comparator<ScheduledCommand> DUE_ORDER = Comparator
        .comparing((ScheduledCommand c) -> c.dueTime() != null ? c.dueTime() : c.createdTime())
        .thenComparing(ScheduledCommand::createdTime)
        .thenComparingLong(c -> Math.abs(c.sequenceNumber()));

    private final Map<String, SchedulerClock> clocks = new HashMap<>();
    private final Map<UUID, TreeMap<Long, ScheduledCommand>> commands = new HashMap<>();
    private final List<CommandExecutionError> errors = new ArrayList<>();

    @Override
    public synchronized Optional<SchedulerClock> findClock(String name) {
        return Optional.ofNullable(clocks.get(name));
    }

    @Override
    public synchronized SchedulerClock getOrCreateClock(String name, Instant startTime) {
        return clocks.computeIfAbsent(name, n -> new SchedulerClock(n, startTime, startTime));
    }

    @Override
    public synchronized void updateClock(SchedulerClock clock) {
        clocks.put(clock.name(), clock);
    }

    @Override
    public synchronized Optional<ScheduledCommand> insert(ScheduledCommand command) {
        TreeMap<Long, ScheduledCommand> forAggregate = commands.computeIfAbsent(command.aggregateId(), id -> new TreeMap<>());
        boolean etagTaken = command.etag() != null && forAggregate.values().stream()
            .anyMatch(existing -> Objects.equals(existing.etag(), command.etag()));
        if (etagTaken) {
            return Optional.empty();
        }

        ScheduledCommand toStore = command;
        if (command.sequenceNumber() == 0) {
            long lowest = forAggregate.isEmpty() ? 0 : Math.min(0, forAggregate.firstKey());
            toStore = command.withSequenceNumber(lowest - 1);
        } else if (forAggregate.containsKey(command.sequenceNumber())) {
            return Optional.empty();
        }
        forAggregate.put(toStore.sequenceNumber(), toStore);
        return Optional.of(toStore);
    }

    @Override
    public synchronized Optional<ScheduledCommand> find(UUID aggregateId, long sequenceNumber) {
        TreeMap<Long, ScheduledCommand> forAggregate = commands.get(aggregateId);
        return forAggregate == null ? Optional.empty() : Optional.ofNullable(forAggregate.get(sequenceNumber));
    }

    @Override
    public synchronized List<ScheduledCommand> findDue(String clockName, Instant asOf) {
        return commands.values().stream()
            .flatMap(m -> m.values().stream())
            .filter(c -> c.clockName().equals(clockName))
            .filter(c -> c.isDue(asOf))
            .sorted(DUE_ORDER)
            .toList();
    }

    @Override
    public synchronized void update(ScheduledCommand command) {
        TreeMap<Long, ScheduledCommand> forAggregate = commands.get(command.aggregateId());
        if (forAggregate == null || !forAggregate.containsKey(command.sequenceNumber())) {
            throw new IllegalArgumentException("Unknown scheduled command " + command);
        }
        forAggregate.put(command.sequenceNumber(), command);
    }

    @Override
    public synchronized void addError(CommandExecutionError error) {
        errors.add(error);
    }

    @Override
    public synchronized List<CommandExecutionError> errors(UUID aggregateId, long sequenceNumber) {
        return errors.stream()
            .filter(e -> e.aggregateId().equals(aggregateId) && e.sequenceNumber() == sequenceNumber)
            .toList();
    }

    @Override
    public synchronized SchedulerStatistics statistics(String clockName, Instant asOf) {
        long pending = 0;
        long due = 0;
        long delivered = 0;
        long finalized = 0;
        for (TreeMap<Long, ScheduledCommand> forAggregate : commands.values()) {
            for (ScheduledCommand command : forAggregate.values()) {
                if (!command.clockName().equals(clockName)) {
                    continue;
                }
                if (command.isDelivered()) {
                    delivered++;
                } else if (command.isFinal()) {
                    finalized++;
                } else {
                    pending++;
                    if (command.isDue(asOf)) {
                        due++;
                    }
                }
            }
        }
        return new SchedulerStatistics(pending, due, delivered, finalized);
    }

    public synchronized void clear() {
        clocks.clear();
        commands.clear();
        errors.clear();
    }
}
