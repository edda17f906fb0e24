package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.exception.CommandValidationException;
import com.ivamare.eventsourcing.model.CommandOutcome;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.EventSequence;
import com.ivamare.eventsourcing.model.ValidationReport;
import com.ivamare.eventsourcing.scheduler.CommandScheduled;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Base class of aggregates whose state is the fold of their event history.
 *
 * <p>The version counts committed events only: it is the highest stored sequence number, even
 * when some stored events could not be read back. Events recorded while a command is enacted
 * stay pending, numbered from {@code version + 1}, until {@link #confirmSave()}.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class EventSourcedAggregate {

    private final UUID id;
    private final EventSequence history;
    private EventSequence pending;
    private long version;
    private Set<String> snapshotETags = Set.of();

    private CommandContext activeContext;
    private String activeCommandETag;
    private boolean commandETagRecorded;

    protected EventSourcedAggregate(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
        this.history = new EventSequence(id);
        this.pending = new EventSequence(id, 0);
    }

    /**
     * Registration of this aggregate's events, commands and handlers.
     */
    protected abstract AggregateType<? extends EventSourcedAggregate> aggregateType();

    public UUID getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public List<Event> getEventHistory() {
        return history.toList();
    }

    public List<Event> getPendingEvents() {
        return pending.toList();
    }

    public boolean hasPendingEvents() {
        return !pending.isEmpty();
    }

    /**
     * Whether an event with this etag was recorded, committed or pending. Aggregates restored
     * from a snapshot also consult the etags captured with the snapshot.
     */
    public boolean hasETag(String etag) {
        if (etag == null) {
            return false;
        }
        return history.containsETag(etag) || pending.containsETag(etag) || snapshotETags.contains(etag);
    }

    /**
     * Apply a command through {@link CommandApplier}.
     *
     * @throws com.ivamare.eventsourcing.exception.HandlerNotFoundException if this aggregate type
     *         does not accept the command
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public CommandOutcome apply(Command<?> command, CommandContext context) {
        AggregateType type = aggregateType();
        return type.apply(this, (Command) command, context);
    }

    /**
     * Record a new event: stamps metadata, folds it into state and adds it to the pending list.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    protected void recordEvent(Event event) {
        event.setAggregateId(id);
        event.setStreamName(aggregateType().name());
        if (event.getEtag() == null) {
            if (activeCommandETag != null && !commandETagRecorded) {
                event.setEtag(activeCommandETag);
                commandETagRecorded = true;
            } else {
                event.setEtag(UUID.randomUUID().toString());
            }
        }
        if (activeContext != null) {
            event.setTimestamp(activeContext.clock().now());
            event.setActor(activeContext.principal().name());
        }
        pending.add(event);
        ((AggregateType) aggregateType()).applyEvent(this, event);
    }

    /**
     * Record a {@link CommandScheduled} event. Once it is saved and published the scheduler
     * stores the command and delivers it to this aggregate when due.
     *
     * @param command command to deliver later
     * @param dueTime when to deliver, null for as soon as possible
     */
    protected void scheduleCommand(Command<?> command, Instant dueTime) {
        scheduleCommand(command, dueTime, null);
    }

    protected void scheduleCommand(Command<?> command, Instant dueTime, String clockName) {
        if (command.getEtag() == null) {
            command.setEtag(UUID.randomUUID().toString());
        }
        CommandScheduled scheduled = new CommandScheduled();
        scheduled.setCommandName(command.commandName());
        scheduled.setCommand(command);
        scheduled.setCommandETag(command.getEtag());
        scheduled.setDueTime(dueTime);
        scheduled.setClockName(clockName);
        recordEvent(scheduled);
    }

    /**
     * Called when state validation fails. Throws by default; override to record a rejection
     * event instead, typically when {@link ValidationReport#isRetryable()}.
     */
    protected void handleCommandValidationFailure(Command<?> command, ValidationReport report) {
        throw new CommandValidationException(command.commandName(), report);
    }

    /**
     * Move pending events into the committed history. Called by repositories after a
     * successful append.
     */
    public void confirmSave() {
        pending.transferTo(history);
        version = Math.max(version, history.version());
        pending = new EventSequence(id, version);
    }

    /**
     * Run {@code action} with a command context bound, so recorded events are stamped with its
     * clock and principal.
     *
     * @param context context to bind
     * @param commandETag etag of the command being enacted, or null
     * @param action code that records events
     */
    public void runInContext(CommandContext context, String commandETag, Runnable action) {
        CommandContext previousContext = activeContext;
        String previousETag = activeCommandETag;
        boolean previousRecorded = commandETagRecorded;
        activeContext = context;
        activeCommandETag = commandETag;
        commandETagRecorded = false;
        try {
            action.run();
        } finally {
            activeContext = previousContext;
            activeCommandETag = previousETag;
            commandETagRecorded = previousRecorded;
        }
    }

    /**
     * The context bound by {@link #runInContext}, or null outside command application.
     */
    protected CommandContext commandContext() {
        return activeContext;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    void replay(Collection<? extends Event> events, long storedVersion) {
        AggregateType type = aggregateType();
        for (Event event : events) {
            type.applyEvent(this, event);
            history.add(event);
        }
        version = Math.max(version, Math.max(storedVersion, history.version()));
        pending = new EventSequence(id, version);
    }

    void restoreSnapshotMetadata(long snapshotVersion, Set<String> etags) {
        version = Math.max(version, snapshotVersion);
        snapshotETags = etags != null ? Set.copyOf(etags) : Set.of();
        pending = new EventSequence(id, version);
    }

    /**
     * Etags of every committed event, including those carried over from a snapshot.
     */
    public Set<String> committedETags() {
        Set<String> etags = new HashSet<>(snapshotETags);
        for (Event event : history) {
            if (event.getEtag() != null) {
                etags.add(event.getEtag());
            }
        }
        return etags;
    }
}
