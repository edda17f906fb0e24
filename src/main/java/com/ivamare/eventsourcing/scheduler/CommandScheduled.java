package com.ivamare.eventsourcing.scheduler;

import com.ivamare.eventsourcing.model.Event;

import java.time.Instant;

/**
 * Recorded by an aggregate that wants a command delivered to itself later. The
 * {@link CommandSchedulingEventHandler} stores the command once this event is committed.
 *
 * <p>{@code command} is the command object when published in process and its JSON map when
 * read back from storage.
 */
public class CommandScheduled extends Event {

    private String commandName;
    private Object command;
    private String commandETag;
    private Instant dueTime;
    private String clockName;

    public String getCommandName() {
        return commandName;
    }

    public void setCommandName(String commandName) {
        this.commandName = commandName;
    }

    public Object getCommand() {
        return command;
    }

    public void setCommand(Object command) {
        this.command = command;
    }

    public String getCommandETag() {
        return commandETag;
    }

    public void setCommandETag(String commandETag) {
        this.commandETag = commandETag;
    }

    public Instant getDueTime() {
        return dueTime;
    }

    public void setDueTime(Instant dueTime) {
        this.dueTime = dueTime;
    }

    public String getClockName() {
        return clockName;
    }

    public void setClockName(String clockName) {
        this.clockName = clockName;
    }
}
