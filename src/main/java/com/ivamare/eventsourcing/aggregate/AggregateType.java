package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerRegistry;
import com.ivamare.eventsourcing.handler.impl.DefaultCommandHandlerRegistry;
import com.ivamare.eventsourcing.model.CommandOutcome;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.scheduler.CommandScheduled;
import com.ivamare.eventsourcing.snapshot.Snapshot;
import com.ivamare.eventsourcing.snapshot.SnapshotSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Everything the runtime needs to know about one aggregate class: its stream name, how to
 * create instances, which events fold into its state and which commands it accepts.
 *
 * <p>Example:
 * <pre>
 * AggregateType&lt;Order&gt; ORDER = AggregateType.builder(Order.class, Order::new)
 *     .event(ItemAdded.class, Order::on)
 *     .command(AddItem.class, Order::enact)
 *     .command(ChargeCreditCard.class, new ChargeHandler(gateway), RetryPolicy.noRetry())
 *     .build();
 * </pre>
 *
 * @param <T> aggregate class
 */
public final class AggregateType<T extends EventSourcedAggregate> {

    private static final Logger log = LoggerFactory.getLogger(AggregateType.class);

    private final String name;
    private final Class<T> aggregateClass;
    private final Function<UUID, T> factory;
    private final Map<Class<? extends Event>, BiConsumer<T, Event>> appliers;
    private final Map<String, Class<? extends Event>> eventTypes;
    private final Map<String, Class<? extends Command<T>>> commandTypes;
    private final CommandHandlerRegistry handlers;
    private final Map<String, RetryPolicy> retryPolicies;
    private final SnapshotSupport<T, ?> snapshotSupport;

    private AggregateType(Builder<T> builder) {
        this.name = builder.name;
        this.aggregateClass = builder.aggregateClass;
        this.factory = builder.factory;
        this.appliers = Map.copyOf(builder.appliers);
        this.eventTypes = Map.copyOf(builder.eventTypes);
        this.commandTypes = Map.copyOf(builder.commandTypes);
        this.handlers = builder.handlers;
        this.retryPolicies = Map.copyOf(builder.retryPolicies);
        this.snapshotSupport = builder.snapshotSupport;
    }

    public static <T extends EventSourcedAggregate> Builder<T> builder(Class<T> aggregateClass, Function<UUID, T> factory) {
        return new Builder<>(aggregateClass, factory);
    }

    /**
     * Stream name events of this aggregate are stored under.
     */
    public String name() {
        return name;
    }

    public Class<T> aggregateClass() {
        return aggregateClass;
    }

    /**
     * A fresh aggregate at version 0.
     */
    public T newInstance(UUID id) {
        return factory.apply(id);
    }

    /**
     * Rebuild an aggregate by folding {@code events} in order.
     *
     * @param id aggregate id
     * @param events readable events, ordered by sequence number
     * @param storedVersion highest sequence number in storage, including unreadable events
     */
    public T fromEventHistory(UUID id, List<? extends Event> events, long storedVersion) {
        T aggregate = newInstance(id);
        aggregate.replay(events, storedVersion);
        return aggregate;
    }

    /**
     * Rebuild an aggregate from snapshot state plus the events recorded after it.
     *
     * @param snapshot snapshot metadata
     * @param state deserialized snapshot state
     * @param delta readable events after the snapshot version
     * @param storedVersion highest sequence number in storage
     */
    @SuppressWarnings("unchecked")
    public T fromSnapshot(Snapshot snapshot, Object state, List<? extends Event> delta, long storedVersion) {
        SnapshotSupport<T, Object> support = (SnapshotSupport<T, Object>) snapshotSupport()
            .orElseThrow(() -> new IllegalStateException(name + " does not support snapshots"));
        T aggregate = newInstance(snapshot.aggregateId());
        support.restore(aggregate, state);
        aggregate.restoreSnapshotMetadata(snapshot.version(), snapshot.etags());
        aggregate.replay(delta, storedVersion);
        return aggregate;
    }

    /**
     * Fold one event into the aggregate's state. Events without a registered applier change
     * nothing.
     */
    public void applyEvent(T aggregate, Event event) {
        BiConsumer<T, Event> applier = appliers.get(event.getClass());
        if (applier == null) {
            log.debug("No applier for {} on {}, ignoring", event.eventName(), name);
            return;
        }
        applier.accept(aggregate, event);
    }

    public Optional<Class<? extends Event>> eventClass(String eventName) {
        return Optional.ofNullable(eventTypes.get(eventName));
    }

    public Optional<Class<? extends Command<T>>> commandClass(String commandName) {
        return Optional.ofNullable(commandTypes.get(commandName));
    }

    /**
     * @throws com.ivamare.eventsourcing.exception.HandlerNotFoundException if none is registered
     */
    @SuppressWarnings("unchecked")
    public <C extends Command<T>> CommandHandler<T, C> handlerFor(C command) {
        return (CommandHandler<T, C>) handlers.getOrThrow(name, command.commandName());
    }

    public Optional<RetryPolicy> retryPolicyFor(String commandName) {
        return Optional.ofNullable(retryPolicies.get(commandName));
    }

    public Optional<SnapshotSupport<T, ?>> snapshotSupport() {
        return Optional.ofNullable(snapshotSupport);
    }

    /**
     * Apply a command; see {@link CommandApplier}.
     */
    public CommandOutcome apply(T target, Command<T> command, CommandContext context) {
        return CommandApplier.apply(this, target, command, context);
    }

    @Override
    public String toString() {
        return "AggregateType(" + name + ")";
    }

    /**
     * Builder for {@link AggregateType}.
     */
    public static final class Builder<T extends EventSourcedAggregate> {

        private final Class<T> aggregateClass;
        private final Function<UUID, T> factory;
        private String name;
        private final Map<Class<? extends Event>, BiConsumer<T, Event>> appliers = new HashMap<>();
        private final Map<String, Class<? extends Event>> eventTypes = new HashMap<>();
        private final Map<String, Class<? extends Command<T>>> commandTypes = new HashMap<>();
        private final Map<String, RetryPolicy> retryPolicies = new HashMap<>();
        private CommandHandlerRegistry handlers = new DefaultCommandHandlerRegistry();
        private SnapshotSupport<T, ?> snapshotSupport;

        private Builder(Class<T> aggregateClass, Function<UUID, T> factory) {
            this.aggregateClass = Objects.requireNonNull(aggregateClass, "aggregateClass");
            this.factory = Objects.requireNonNull(factory, "factory");
            this.name = aggregateClass.getSimpleName();
        }

        /**
         * Override the stream name, which defaults to the simple class name.
         */
        public Builder<T> name(String name) {
            if (!commandTypes.isEmpty()) {
                throw new IllegalStateException("name must be set before commands are registered");
            }
            this.name = name;
            return this;
        }

        /**
         * Register an event type whose name is its simple class name.
         */
        public <E extends Event> Builder<T> event(Class<E> eventType, BiConsumer<T, ? super E> applier) {
            return event(eventType.getSimpleName(), eventType, applier);
        }

        /**
         * Register an event type that does not change state.
         */
        public <E extends Event> Builder<T> event(Class<E> eventType) {
            return event(eventType, (aggregate, event) -> { });
        }

        @SuppressWarnings("unchecked")
        public <E extends Event> Builder<T> event(String eventName, Class<E> eventType, BiConsumer<T, ? super E> applier) {
            eventTypes.put(eventName, eventType);
            appliers.put(eventType, (aggregate, event) -> applier.accept(aggregate, (E) event));
            return this;
        }

        public <C extends Command<T>> Builder<T> command(Class<C> commandType, CommandHandler<T, C> handler) {
            String commandName = commandType.getSimpleName();
            commandTypes.put(commandName, commandType);
            handlers.register(name, commandName, handler);
            return this;
        }

        /**
         * Register a command with its own retry policy for scheduled delivery.
         */
        public <C extends Command<T>> Builder<T> command(Class<C> commandType, CommandHandler<T, C> handler, RetryPolicy retryPolicy) {
            command(commandType, handler);
            retryPolicies.put(commandType.getSimpleName(), retryPolicy);
            return this;
        }

        /**
         * Share a registry between aggregate types. Must be called before registering commands.
         */
        public Builder<T> handlerRegistry(CommandHandlerRegistry registry) {
            if (!commandTypes.isEmpty()) {
                throw new IllegalStateException("handlerRegistry must be set before commands are registered");
            }
            this.handlers = registry;
            return this;
        }

        public Builder<T> snapshots(SnapshotSupport<T, ?> support) {
            this.snapshotSupport = support;
            return this;
        }

        public AggregateType<T> build() {
            if (!eventTypes.containsKey(CommandScheduled.class.getSimpleName())) {
                event(CommandScheduled.class);
            }
            return new AggregateType<>(this);
        }
    }
}
