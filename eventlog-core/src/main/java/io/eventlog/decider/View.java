package io.eventlog.decider;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Read-side counterpart of a {@link Decider}: the evolve half only. A view folds events into
 * queryable state and has no commands or rejections, so it can project events of any number
 * of aggregates and be rebuilt from the event log at any time.
 *
 * <p>{@link #evolve} must be deterministic and free of side effects, like a decider's.
 *
 * @param <S> state type
 * @param <E> event type
 * @see io.eventlog.view.Projection
 */
public interface View<S, E> {

    /**
     * Applies one event to a state.
     *
     * @param state the state before the event
     * @param event the event
     * @return the state after the event
     */
    S evolve(S state, E event);

    /**
     * Returns the state before any event.
     *
     * @return the initial state
     */
    S initialState();

    default S fold(List<? extends E> events) {
        S current = initialState();
        for (E event : events) {
            current = evolve(current, event);
        }
        return current;
    }

    static <S, E> View<S, E> of(BiFunction<? super S, ? super E, ? extends S> evolve,
                                Supplier<? extends S> initialState) {
        Objects.requireNonNull(evolve, "evolve");
        Objects.requireNonNull(initialState, "initialState");
        return new View<>() {
            @Override
            public S evolve(S state, E event) {
                return evolve.apply(state, event);
            }

            @Override
            public S initialState() {
                return initialState.get();
            }
        };
    }

    /**
     * Views a decider's state evolution, for reading aggregate state outside the runtime.
     *
     * @param decider the decider
     * @param <S>     state type
     * @param <E>     event type
     * @return a view sharing the decider's evolve function and initial state
     */
    static <S, E> View<S, E> of(Decider<?, S, E> decider) {
        Objects.requireNonNull(decider, "decider");
        return of(decider::evolve, decider::initialState);
    }
}
