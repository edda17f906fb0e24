package com.ivamare.eventsourcing.support;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.CommandContext;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.authorization.AuthorizationPolicy;
import com.ivamare.eventsourcing.authorization.Principal;
import com.ivamare.eventsourcing.bus.EventHandlerRegistry;
import com.ivamare.eventsourcing.bus.impl.InProcessEventBus;
import com.ivamare.eventsourcing.clock.VirtualClock;
import com.ivamare.eventsourcing.model.CommandOutcome;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.repository.AggregateRegistry;
import com.ivamare.eventsourcing.repository.impl.DefaultEventSourcedRepository;
import com.ivamare.eventsourcing.scheduler.CommandSchedulingEventHandler;
import com.ivamare.eventsourcing.scheduler.impl.DefaultCommandDeliverer;
import com.ivamare.eventsourcing.scheduler.impl.DefaultCommandScheduler;
import com.ivamare.eventsourcing.scheduler.impl.DefaultSchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.EventStreamPreconditionVerifier;
import com.ivamare.eventsourcing.scheduler.impl.InMemoryScheduledCommandStore;
import com.ivamare.eventsourcing.serialization.CommandSerializer;
import com.ivamare.eventsourcing.serialization.EventSerializer;
import com.ivamare.eventsourcing.snapshot.InMemorySnapshotRepository;
import com.ivamare.eventsourcing.store.EventStream;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStream;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory runtime on a virtual clock: event stream, bus, repositories and scheduler, wired the
 * way the auto-configuration wires them.
 */
public class EventSourcingFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    public static final String CLOCK = "default";

    public final VirtualClock clock = VirtualClock.startingAt(START);
    public final EventSerializer serializer = new EventSerializer(EventSerializer.defaultObjectMapper());
    public final CommandSerializer commandSerializer = new CommandSerializer(serializer.objectMapper());
    public final EventStream eventStream;
    public final InProcessEventBus eventBus = new InProcessEventBus(serializer, new EventHandlerRegistry(), 2);
    public final InMemorySnapshotRepository snapshots = new InMemorySnapshotRepository();
    public final AggregateRegistry aggregateRegistry = new AggregateRegistry();
    public final InMemoryScheduledCommandStore commandStore = new InMemoryScheduledCommandStore();
    public final DefaultCommandDeliverer deliverer;
    public final DefaultCommandScheduler scheduler;
    public final DefaultSchedulerClockTrigger trigger;

    private final Map<Class<?>, DefaultEventSourcedRepository<?>> repositories = new HashMap<>();

    public EventSourcingFixture() {
        this(new InMemoryEventStream());
    }

    public EventSourcingFixture(EventStream eventStream) {
        this.eventStream = eventStream;
        this.deliverer = new DefaultCommandDeliverer(
            aggregateRegistry,
            commandStore,
            commandSerializer,
            new EventStreamPreconditionVerifier(eventStream),
            RetryPolicy.defaultPolicy(),
            AuthorizationPolicy.systemOnly());
        this.trigger = new DefaultSchedulerClockTrigger(commandStore, deliverer);
        this.scheduler = new DefaultCommandScheduler(
            commandStore, aggregateRegistry, commandSerializer, trigger, clock, CLOCK, null);
        eventBus.subscribe(new CommandSchedulingEventHandler(scheduler));
        commandStore.getOrCreateClock(CLOCK, START);
    }

    public <T extends EventSourcedAggregate> DefaultEventSourcedRepository<T> register(AggregateType<T> type) {
        DefaultEventSourcedRepository<T> repository =
            new DefaultEventSourcedRepository<>(type, eventStream, serializer, eventBus, clock, snapshots);
        aggregateRegistry.register(repository);
        repositories.put(type.aggregateClass(), repository);
        return repository;
    }

    @SuppressWarnings("unchecked")
    public <T extends EventSourcedAggregate> DefaultEventSourcedRepository<T> repository(Class<T> aggregateClass) {
        return (DefaultEventSourcedRepository<T>) repositories.get(aggregateClass);
    }

    /**
     * Context of an interactive caller at the current virtual time.
     */
    public CommandContext userContext() {
        return CommandContext.of(clock, Principal.of("alice", "clerk"), AuthorizationPolicy.permitAll());
    }

    /**
     * Load (or create), apply and save.
     */
    public <T extends EventSourcedAggregate> CommandOutcome execute(
            AggregateType<T> type, UUID aggregateId, Command<T> command) {
        DefaultEventSourcedRepository<T> repository = repository(type.aggregateClass());
        T target = repository.getLatest(aggregateId).orElseGet(() -> type.newInstance(aggregateId));
        CommandOutcome outcome = type.apply(target, command, userContext());
        repository.save(target);
        return outcome;
    }

    @Override
    public void close() {
        eventBus.close();
    }
}
