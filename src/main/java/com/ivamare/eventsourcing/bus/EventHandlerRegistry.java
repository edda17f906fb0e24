package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Resolves handler bindings and remembers, per handler class, which events it matches.
 * The memo is append-only and safe for concurrent use.
 */
public class EventHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventHandlerRegistry.class);

    private final Map<Class<?>, Set<MatchEvent>> matchesByHandlerType = new ConcurrentHashMap<>();

    /**
     * Ask the handler for its bindings.
     */
    public List<EventHandlerBinding> bindingsFor(EventHandler handler) {
        EventHandlerBinder binder = new EventHandlerBinder();
        handler.bind(binder);
        List<EventHandlerBinding> bindings = binder.bindings();
        matchesByHandlerType.computeIfAbsent(handler.getClass(), type -> {
            Set<MatchEvent> matches = bindings.stream()
                .map(EventHandlerBinding::match)
                .collect(Collectors.toUnmodifiableSet());
            log.debug("Handler {} binds {}", handler.handlerName(), matches);
            return matches;
        });
        return bindings;
    }

    /**
     * Events a handler class was seen to bind, empty if it was never resolved.
     */
    public Set<MatchEvent> matchesFor(Class<? extends EventHandler> handlerType) {
        return matchesByHandlerType.getOrDefault(handlerType, Set.of());
    }

    public boolean handles(Class<? extends EventHandler> handlerType, Event event) {
        return matchesFor(handlerType).stream().anyMatch(match -> match.matches(event));
    }
}
