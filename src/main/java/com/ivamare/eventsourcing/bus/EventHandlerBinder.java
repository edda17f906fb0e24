package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.DynamicEvent;
import com.ivamare.eventsourcing.model.Event;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects the bindings a handler declares.
 */
public class EventHandlerBinder {

    private final List<EventHandlerBinding> bindings = new ArrayList<>();

    /**
     * React to events of a class.
     */
    public <E extends Event> EventHandlerBinder on(Class<E> eventType, Consumer<? super E> action) {
        bindings.add(new EventHandlerBinding.TypedBinding<>(eventType, action));
        return this;
    }

    /**
     * React to events named {@code type} on {@code streamName}, re-read as {@code shape}.
     * Properties the shape does not declare are ignored. Interfaces and abstract classes that
     * {@link DynamicEvent} satisfies (such as {@code Object}) receive the dynamic representation.
     *
     * @throws IllegalArgumentException if the shape can neither be instantiated nor hold a
     *         {@link DynamicEvent}
     */
    public <S> EventHandlerBinder onShape(String streamName, String type, Class<S> shape, Consumer<? super S> action) {
        boolean instantiable = !shape.isInterface() && !Modifier.isAbstract(shape.getModifiers()) && shape != Object.class;
        if (!instantiable && !shape.isAssignableFrom(DynamicEvent.class)) {
            throw new IllegalArgumentException("Cannot project events onto " + shape.getName());
        }
        bindings.add(new EventHandlerBinding.ShapeBinding<>(MatchEvent.of(streamName, type), shape, !instantiable, action));
        return this;
    }

    /**
     * React to every event matching the pattern, as a {@link DynamicEvent}.
     */
    public EventHandlerBinder onAny(String streamName, String type, Consumer<? super DynamicEvent> action) {
        bindings.add(new EventHandlerBinding.WildcardBinding(MatchEvent.of(streamName, type), action));
        return this;
    }

    public List<EventHandlerBinding> bindings() {
        return List.copyOf(bindings);
    }
}
