package com.ivamare.eventsourcing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.authorization.AuthorizationPolicy;
import com.ivamare.eventsourcing.bus.EventBus;
import com.ivamare.eventsourcing.bus.EventHandler;
import com.ivamare.eventsourcing.bus.EventHandlerRegistry;
import com.ivamare.eventsourcing.bus.impl.InProcessEventBus;
import com.ivamare.eventsourcing.clock.Clock;
import com.ivamare.eventsourcing.repository.AggregateRegistry;
import com.ivamare.eventsourcing.repository.EventSourcedRepository;
import com.ivamare.eventsourcing.repository.impl.DefaultEventSourcedRepository;
import com.ivamare.eventsourcing.scheduler.CommandDeliverer;
import com.ivamare.eventsourcing.scheduler.CommandPreconditionVerifier;
import com.ivamare.eventsourcing.scheduler.CommandScheduler;
import com.ivamare.eventsourcing.scheduler.CommandSchedulingEventHandler;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.ScheduledCommandWakeupSender;
import com.ivamare.eventsourcing.scheduler.SchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.DefaultCommandDeliverer;
import com.ivamare.eventsourcing.scheduler.impl.DefaultCommandScheduler;
import com.ivamare.eventsourcing.scheduler.impl.DefaultSchedulerClockTrigger;
import com.ivamare.eventsourcing.scheduler.impl.EventStreamPreconditionVerifier;
import com.ivamare.eventsourcing.scheduler.impl.InMemoryScheduledCommandStore;
import com.ivamare.eventsourcing.scheduler.impl.JdbcScheduledCommandStore;
import com.ivamare.eventsourcing.serialization.CommandSerializer;
import com.ivamare.eventsourcing.serialization.EventSerializer;
import com.ivamare.eventsourcing.snapshot.InMemorySnapshotRepository;
import com.ivamare.eventsourcing.snapshot.SnapshotRepository;
import com.ivamare.eventsourcing.store.EventStream;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStream;
import com.ivamare.eventsourcing.store.impl.JdbcEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for event sourcing.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event and command serializers</li>
 *   <li>Event stream and scheduled command store (in memory, or JDBC with
 *       {@code eventsourcing.storage=jdbc})</li>
 *   <li>In-process event bus, with every {@link EventHandler} bean subscribed</li>
 *   <li>A repository for every {@link AggregateType} bean</li>
 *   <li>Command scheduler, deliverer and clock trigger</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventsourcing.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    TransactionAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "eventsourcing", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventSourcingProperties.class)
@Import(SchedulerWorkerConfiguration.class)
public class EventSourcingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventSourcingAutoConfiguration.class);

    // --- Storage ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "eventsourcing", name = "storage", havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStream eventStream() {
            return new InMemoryEventStream();
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduledCommandStore scheduledCommandStore() {
            return new InMemoryScheduledCommandStore();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "eventsourcing", name = "storage", havingValue = "jdbc")
    static class JdbcStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStream eventStream(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
            return new JdbcEventStream(jdbcTemplate, transactionTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduledCommandStore scheduledCommandStore(JdbcTemplate jdbcTemplate) {
            return new JdbcScheduledCommandStore(jdbcTemplate);
        }
    }

    // --- Serialization ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventSourcingObjectMapper() {
        return EventSerializer.defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer(ObjectMapper objectMapper) {
        return new EventSerializer(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandSerializer commandSerializer(ObjectMapper objectMapper) {
        return new CommandSerializer(objectMapper);
    }

    // --- Clock and Authorization ---

    @Bean
    @ConditionalOnMissingBean
    public Clock eventSourcingClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationPolicy scheduledCommandAuthorizationPolicy() {
        return AuthorizationPolicy.systemOnly();
    }

    // --- Event Bus ---

    @Bean
    @ConditionalOnMissingBean
    public EventHandlerRegistry eventHandlerRegistry() {
        return new EventHandlerRegistry();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(EventBus.class)
    public InProcessEventBus eventBus(EventSerializer serializer, EventHandlerRegistry registry,
                                      EventSourcingProperties properties) {
        return new InProcessEventBus(serializer, registry, properties.getBus().getHandlerThreads());
    }

    /**
     * Subscribes every {@link EventHandler} bean once all singletons exist, so handlers may
     * depend on repositories and the scheduler.
     */
    @Bean
    public SmartInitializingSingleton eventHandlerSubscriber(EventBus eventBus, ObjectProvider<EventHandler> handlers) {
        return () -> handlers.orderedStream().forEach(handler -> {
            eventBus.subscribe(handler);
            log.info("Subscribed event handler {}", handler.handlerName());
        });
    }

    // --- Snapshots ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventsourcing.snapshot", name = "enabled", havingValue = "true")
    public SnapshotRepository snapshotRepository() {
        return new InMemorySnapshotRepository();
    }

    // --- Repositories ---

    @Bean
    @ConditionalOnMissingBean
    public AggregateRegistry aggregateRegistry(
            ObjectProvider<AggregateType<?>> aggregateTypes,
            ObjectProvider<EventSourcedRepository<?>> repositories,
            EventStream eventStream,
            EventSerializer serializer,
            EventBus eventBus,
            Clock clock,
            ObjectProvider<SnapshotRepository> snapshotRepository) {
        AggregateRegistry registry = new AggregateRegistry();
        List<String> registered = new ArrayList<>();
        repositories.orderedStream().forEach(repository -> {
            registry.register(repository);
            registered.add(repository.aggregateType().name());
        });
        SnapshotRepository snapshots = snapshotRepository.getIfAvailable();
        aggregateTypes.orderedStream()
            .filter(type -> !registered.contains(type.name()))
            .forEach(type -> registerDefault(registry, type, eventStream, serializer, eventBus, clock, snapshots));
        log.info("Event sourcing ready for aggregate types {}", registry.aggregateTypeNames());
        return registry;
    }

    private static <T extends EventSourcedAggregate> void registerDefault(
            AggregateRegistry registry, AggregateType<T> type, EventStream eventStream,
            EventSerializer serializer, EventBus eventBus, Clock clock, SnapshotRepository snapshots) {
        registry.register(new DefaultEventSourcedRepository<>(type, eventStream, serializer, eventBus, clock, snapshots));
    }

    // --- Scheduler ---

    @Bean
    @ConditionalOnMissingBean
    public CommandPreconditionVerifier commandPreconditionVerifier(EventStream eventStream) {
        return new EventStreamPreconditionVerifier(eventStream);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandDeliverer commandDeliverer(
            AggregateRegistry aggregateRegistry,
            ScheduledCommandStore store,
            CommandSerializer commandSerializer,
            CommandPreconditionVerifier preconditionVerifier,
            AuthorizationPolicy authorizationPolicy,
            EventSourcingProperties properties) {
        return new DefaultCommandDeliverer(
            aggregateRegistry,
            store,
            commandSerializer,
            preconditionVerifier,
            properties.getScheduler().toRetryPolicy(),
            authorizationPolicy
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerClockTrigger schedulerClockTrigger(ScheduledCommandStore store, CommandDeliverer deliverer) {
        return new DefaultSchedulerClockTrigger(store, deliverer);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandScheduler commandScheduler(
            ScheduledCommandStore store,
            AggregateRegistry aggregateRegistry,
            CommandSerializer commandSerializer,
            SchedulerClockTrigger trigger,
            Clock clock,
            EventSourcingProperties properties,
            ObjectProvider<ScheduledCommandWakeupSender> wakeupSender) {
        return new DefaultCommandScheduler(
            store,
            aggregateRegistry,
            commandSerializer,
            trigger,
            clock,
            properties.getScheduler().getDefaultClockName(),
            wakeupSender.getIfAvailable(ScheduledCommandWakeupSender::none)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandSchedulingEventHandler commandSchedulingEventHandler(CommandScheduler commandScheduler) {
        return new CommandSchedulingEventHandler(commandScheduler);
    }
}
