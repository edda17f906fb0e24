package com.ivamare.eventsourcing.repository;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.exception.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregate types known to the process, by stream name, with their repositories. The scheduler
 * resolves the target of a stored command through it.
 */
public class AggregateRegistry {

    private static final Logger log = LoggerFactory.getLogger(AggregateRegistry.class);

    private final Map<String, Registration<?>> registrations = new ConcurrentHashMap<>();

    public <T extends EventSourcedAggregate> void register(EventSourcedRepository<T> repository) {
        AggregateType<T> type = repository.aggregateType();
        if (registrations.putIfAbsent(type.name(), new Registration<>(type, repository)) != null) {
            throw new IllegalArgumentException("Aggregate type " + type.name() + " is already registered");
        }
        log.debug("Registered aggregate type {}", type.name());
    }

    public Optional<Registration<?>> find(String aggregateTypeName) {
        return Optional.ofNullable(registrations.get(aggregateTypeName));
    }

    /**
     * @throws SchedulingException if the name is unknown
     */
    public Registration<?> getOrThrow(String aggregateTypeName) {
        return find(aggregateTypeName)
            .orElseThrow(() -> new SchedulingException("Unknown aggregate type " + aggregateTypeName));
    }

    @SuppressWarnings("unchecked")
    public <T extends EventSourcedAggregate> EventSourcedRepository<T> repository(Class<T> aggregateClass) {
        for (Registration<?> registration : registrations.values()) {
            if (registration.type().aggregateClass() == aggregateClass) {
                return (EventSourcedRepository<T>) registration.repository();
            }
        }
        throw new SchedulingException("No repository registered for " + aggregateClass.getName());
    }

    public List<String> aggregateTypeNames() {
        return List.copyOf(registrations.keySet());
    }

    /**
     * @param type aggregate type
     * @param repository its repository
     */
    public record Registration<T extends EventSourcedAggregate>(AggregateType<T> type, EventSourcedRepository<T> repository) {
    }
}
