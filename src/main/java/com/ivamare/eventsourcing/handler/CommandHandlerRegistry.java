package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Registry of command handlers keyed by (aggregate type, command name).
 */
public interface CommandHandlerRegistry {

    /**
     * Register a handler.
     *
     * @throws HandlerAlreadyRegisteredException if the command already has a handler
     */
    void register(String aggregateType, String commandName, CommandHandler<?, ?> handler);

    Optional<CommandHandler<?, ?>> get(String aggregateType, String commandName);

    /**
     * @throws HandlerNotFoundException if no handler is registered
     */
    CommandHandler<?, ?> getOrThrow(String aggregateType, String commandName);

    boolean hasHandler(String aggregateType, String commandName);

    List<HandlerKey> registeredHandlers();

    void clear();

    /**
     * @param aggregateType aggregate type name
     * @param commandName command name
     */
    record HandlerKey(String aggregateType, String commandName) {
        @Override
        public String toString() {
            return aggregateType + "." + commandName;
        }
    }
}
