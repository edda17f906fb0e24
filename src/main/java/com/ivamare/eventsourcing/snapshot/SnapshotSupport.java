package com.ivamare.eventsourcing.snapshot;

import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Extracts and restores the snapshot state of an aggregate type.
 *
 * @param <T> aggregate type
 * @param <S> Jackson-serializable state type
 */
public interface SnapshotSupport<T extends EventSourcedAggregate, S> {

    Class<S> stateType();

    S capture(T aggregate);

    void restore(T aggregate, S state);

    static <T extends EventSourcedAggregate, S> SnapshotSupport<T, S> of(
            Class<S> stateType, Function<T, S> capture, BiConsumer<T, S> restore) {
        return new SnapshotSupport<>() {
            @Override
            public Class<S> stateType() {
                return stateType;
            }

            @Override
            public S capture(T aggregate) {
                return capture.apply(aggregate);
            }

            @Override
            public void restore(T aggregate, S state) {
                restore.accept(aggregate, state);
            }
        };
    }
}
