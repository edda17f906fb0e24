package com.ivamare.eventsourcing.handler.impl;

import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of CommandHandlerRegistry. Handlers are registered explicitly,
 * usually through {@link com.ivamare.eventsourcing.aggregate.AggregateType.Builder}.
 */
public class DefaultCommandHandlerRegistry implements CommandHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandHandlerRegistry.class);

    private final Map<HandlerKey, CommandHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String aggregateType, String commandName, CommandHandler<?, ?> handler) {
        var key = new HandlerKey(aggregateType, commandName);
        if (handlers.putIfAbsent(key, handler) != null) {
            throw new HandlerAlreadyRegisteredException(aggregateType, commandName);
        }
        log.debug("Registered handler for {}.{}", aggregateType, commandName);
    }

    @Override
    public Optional<CommandHandler<?, ?>> get(String aggregateType, String commandName) {
        return Optional.ofNullable(handlers.get(new HandlerKey(aggregateType, commandName)));
    }

    @Override
    public CommandHandler<?, ?> getOrThrow(String aggregateType, String commandName) {
        return get(aggregateType, commandName)
            .orElseThrow(() -> new HandlerNotFoundException(aggregateType, commandName));
    }

    @Override
    public boolean hasHandler(String aggregateType, String commandName) {
        return handlers.containsKey(new HandlerKey(aggregateType, commandName));
    }

    @Override
    public List<HandlerKey> registeredHandlers() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public void clear() {
        handlers.clear();
    }
}
