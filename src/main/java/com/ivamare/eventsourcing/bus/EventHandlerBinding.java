package com.ivamare.eventsourcing.bus;

import com.ivamare.eventsourcing.model.DynamicEvent;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.serialization.EventSerializer;

import java.util.function.Consumer;

/**
 * One (event pattern, action) pair declared by a handler. All three shapes dispatch through
 * {@link #dispatch(Event, EventSerializer)}.
 */
public sealed interface EventHandlerBinding
    permits EventHandlerBinding.TypedBinding, EventHandlerBinding.ShapeBinding, EventHandlerBinding.WildcardBinding {

    MatchEvent match();

    boolean matches(Event event);

    void dispatch(Event event, EventSerializer serializer);

    /**
     * Receives instances of an event class (and its subclasses) from any stream.
     */
    record TypedBinding<E extends Event>(Class<E> eventType, Consumer<? super E> action) implements EventHandlerBinding {

        @Override
        public MatchEvent match() {
            return MatchEvent.ofType(eventType == Event.class ? MatchEvent.WILDCARD : eventType.getSimpleName());
        }

        @Override
        public boolean matches(Event event) {
            return eventType.isInstance(event);
        }

        @Override
        public void dispatch(Event event, EventSerializer serializer) {
            action.accept(eventType.cast(event));
        }
    }

    /**
     * Receives matching events re-read as {@code shape}. When {@code dynamic}, the shape cannot
     * be instantiated and the event is passed as a {@link DynamicEvent}.
     */
    record ShapeBinding<S>(MatchEvent match, Class<S> shape, boolean dynamic, Consumer<? super S> action)
        implements EventHandlerBinding {

        @Override
        public boolean matches(Event event) {
            return match.matches(event);
        }

        @Override
        public void dispatch(Event event, EventSerializer serializer) {
            S payload = dynamic
                ? shape.cast(serializer.toDynamic(event))
                : serializer.project(event, shape);
            action.accept(payload);
        }
    }

    /**
     * Receives every matching event as a {@link DynamicEvent}.
     */
    record WildcardBinding(MatchEvent match, Consumer<? super DynamicEvent> action) implements EventHandlerBinding {

        @Override
        public boolean matches(Event event) {
            return match.matches(event);
        }

        @Override
        public void dispatch(Event event, EventSerializer serializer) {
            action.accept(serializer.toDynamic(event));
        }
    }
}
