package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.bus.Consequenter;
import com.ivamare.eventsourcing.bus.EventHandlerBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the commands aggregates announce through {@link CommandScheduled} events.
 */
public class CommandSchedulingEventHandler implements Consequenter {

    private static final Logger log = LoggerFactory.getLogger(CommandSchedulingEventHandler.class);

    private final CommandScheduler scheduler;

    public CommandSchedulingEventHandler(CommandScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void bind(EventHandlerBinder binder) {
        binder.on(CommandScheduled.class, this::onCommandScheduled);
    }

    void onCommandScheduled(CommandScheduled event) {
        ScheduledCommandResult result = scheduler.schedule(event);
        log.debug("Scheduled {} announced by {}.{}: {}",
            event.getCommandName(), event.getStreamName(), event.getAggregateId(),
            result.getClass().getSimpleName());
    }
}
