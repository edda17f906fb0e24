package com.ivamare.eventsourcing.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.exception.EventSerializationException;

/**
 * Converts commands to and from the JSON stored with scheduled commands.
 */
public class CommandSerializer {

    private final ObjectMapper objectMapper;

    public CommandSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(Command<?> command) {
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize command " + command.commandName(), e);
        }
    }

    /**
     * @throws EventSerializationException if the command is not registered on {@code type} or
     *         the body cannot be read
     */
    public <T extends EventSourcedAggregate> Command<T> deserialize(AggregateType<T> type, String commandName, String body) {
        Class<? extends Command<T>> commandClass = commandClass(type, commandName);
        try {
            return objectMapper.readValue(body, commandClass);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot read " + type.name() + "." + commandName, e);
        }
    }

    /**
     * Turn a command payload carried inside an event into a command. In process the payload is
     * the command itself; read back from storage it is a JSON map.
     */
    @SuppressWarnings("unchecked")
    public <T extends EventSourcedAggregate> Command<T> convert(AggregateType<T> type, String commandName, Object payload) {
        Class<? extends Command<T>> commandClass = commandClass(type, commandName);
        if (commandClass.isInstance(payload)) {
            return (Command<T>) payload;
        }
        try {
            return objectMapper.convertValue(payload, commandClass);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Cannot read " + type.name() + "." + commandName, e);
        }
    }

    private <T extends EventSourcedAggregate> Class<? extends Command<T>> commandClass(AggregateType<T> type, String commandName) {
        return type.commandClass(commandName)
            .orElseThrow(() -> new EventSerializationException(
                "Unknown command " + commandName + " for " + type.name()));
    }
}
