package com.ivamare.eventsourcing.scheduler.impl;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.exception.SchedulingException;
import com.ivamare.eventsourcing.repository.AggregateRegistry;
import com.ivamare.eventsourcing.scheduler.CommandDeduplicated;
import com.ivamare.eventsourcing.scheduler.CommandPending;
import com.ivamare.eventsourcing.scheduler.CommandScheduled;
import com.ivamare.eventsourcing.scheduler.CommandScheduler;
import com.ivamare.eventsourcing.scheduler.DeliveryPrecondition;
import com.ivamare.eventsourcing.scheduler.ScheduledCommand;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandResult;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandWakeupSender;
import com.ivamare.eventsourcing.scheduler.SchedulerClock;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import com.ivamare.eventsourcing.serialization.CommandSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of CommandScheduler.
 */
public class DefaultCommandScheduler implements CommandScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandScheduler.class);

    private final ScheduledCommandStore store;
    private final AggregateRegistry aggregateRegistry;
    private final CommandSerializer commandSerializer;
    private final SchedulerClockTrigger trigger;
    private final Clock clock;
    private final String defaultClockName;
    private final ScheduledCommandWakeupSender wakeupSender;

    /**
     * @param store command storage
     * @param aggregateRegistry resolves the target type of announced commands
     * @param commandSerializer command JSON
     * @param trigger delivers commands that are already due, one delivery per command at a time
     * @param clock start time for clocks created on first use
     * @param defaultClockName clock used when none is given
     * @param wakeupSender notified of every stored command
     */
    public DefaultCommandScheduler(
            ScheduledCommandStore store,
            AggregateRegistry aggregateRegistry,
            CommandSerializer commandSerializer,
            SchedulerClockTrigger trigger,
            Clock clock,
            String defaultClockName,
            ScheduledCommandWakeupSender wakeupSender) {
        this.store = store;
        this.aggregateRegistry = aggregateRegistry;
        this.commandSerializer = commandSerializer;
        this.trigger = trigger;
        this.clock = clock;
        this.defaultClockName = defaultClockName;
        this.wakeupSender = wakeupSender != null ? wakeupSender : ScheduledCommandWakeupSender.none();
    }

    @Override
    public <T extends EventSourcedAggregate> ScheduledCommandResult schedule(
            AggregateType<T> type, UUID aggregateId, Command<T> command,
            Instant dueTime, DeliveryPrecondition precondition, String clockName) {
        if (command.getEtag() == null) {
            command.setEtag(UUID.randomUUID().toString());
        }
        return store(type, aggregateId, 0, command, dueTime, precondition, clockName);
    }

    @Override
    public ScheduledCommandResult schedule(CommandScheduled announcement) {
        AggregateRegistry.Registration<?> registration = aggregateRegistry.getOrThrow(announcement.getStreamName());
        return scheduleAnnounced(registration.type(), announcement);
    }

    private <T extends EventSourcedAggregate> ScheduledCommandResult scheduleAnnounced(
            AggregateType<T> type, CommandScheduled announcement) {
        Command<T> command = commandSerializer.convert(type, announcement.getCommandName(), announcement.getCommand());
        if (command.getEtag() == null) {
            command.setEtag(announcement.getCommandETag());
        }
        DeliveryPrecondition precondition = DeliveryPrecondition.eventHasBeenRecorded(
            announcement.getAggregateId(), announcement.getEtag());
        return store(type, announcement.getAggregateId(), announcement.getSequenceNumber(), command,
            announcement.getDueTime(), precondition, announcement.getClockName());
    }

    private <T extends EventSourcedAggregate> ScheduledCommandResult store(
            AggregateType<T> type, UUID aggregateId, long sequenceNumber, Command<T> command,
            Instant dueTime, DeliveryPrecondition precondition, String clockName) {
        String resolvedClock = clockName != null ? clockName : defaultClockName;
        SchedulerClock schedulerClock = store.getOrCreateClock(resolvedClock, clock.now());

        ScheduledCommand row = new ScheduledCommand(
            aggregateId,
            sequenceNumber,
            type.name(),
            command.commandName(),
            commandSerializer.serialize(command),
            command.getEtag(),
            schedulerClock.utcNow(),
            dueTime,
            null,
            null,
            0,
            resolvedClock,
            precondition
        );

        Optional<ScheduledCommand> stored = store.insert(row);
        if (stored.isEmpty()) {
            log.info("Command {}.{} with etag {} is already scheduled for {}",
                type.name(), command.commandName(), command.getEtag(), aggregateId);
            return new CommandDeduplicated(row);
        }

        ScheduledCommand scheduled = stored.get();
        log.debug("Scheduled {} on clock {}", scheduled, resolvedClock);
        wakeupSender.commandScheduled(scheduled);

        if (scheduled.isDue(schedulerClock.utcNow())) {
            return trigger.deliver(scheduled.aggregateId(), scheduled.sequenceNumber())
                .orElseThrow(() -> new SchedulingException("Scheduled command " + scheduled + " disappeared"));
        }
        return new CommandPending(scheduled, CommandPending.Reason.NOT_DUE);
    }
}
