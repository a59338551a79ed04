package io.eventlog.decider;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Pure decision logic of one aggregate type: a function pair plus an initial state.
 *
 * <ul>
 *   <li>{@link #decide} maps (command, state) to events or a rejection</li>
 *   <li>{@link #evolve} applies one event to a state</li>
 *   <li>{@link #initialState} is the state before the first event</li>
 * </ul>
 *
 * <p>Both functions must be deterministic and free of side effects: no I/O, no clock, no
 * randomness. Anything time- or id-dependent belongs in the command. The signatures return
 * plain values, so a decider cannot suspend or perform asynchronous work.
 *
 * <p>The same decider drives command handling and read-side state reconstruction via
 * {@link #fold}.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @see io.eventlog.runtime.AggregateRuntime
 */
public interface Decider<C, S, E> {

    /**
     * Decides which events a command produces in the given state.
     *
     * @param command the command
     * @param state   the current state, obtained by folding all prior events
     * @return the decision, never {@code null}
     */
    Decision<E> decide(C command, S state);

    /**
     * Applies one event to a state.
     *
     * @param state the state before the event
     * @param event the event
     * @return the state after the event
     */
    S evolve(S state, E event);

    /**
     * Returns the state of an aggregate with no events.
     *
     * @return the initial state
     */
    S initialState();

    /**
     * Folds events onto the initial state.
     *
     * @param events events in aggregate order
     * @return the resulting state
     */
    default S fold(List<? extends E> events) {
        return foldFrom(initialState(), events);
    }

    /**
     * Folds events onto an arbitrary starting state.
     *
     * @param state  the starting state
     * @param events events in aggregate order
     * @return the resulting state
     */
    default S foldFrom(S state, List<? extends E> events) {
        S current = state;
        for (E event : events) {
            current = evolve(current, event);
        }
        return current;
    }

    /**
     * Builds a decider from three functions.
     *
     * @param decide       the decide function
     * @param evolve       the evolve function
     * @param initialState supplier of the initial state
     * @param <C>          command type
     * @param <S>          state type
     * @param <E>          event type
     * @return a decider delegating to the functions
     */
    static <C, S, E> Decider<C, S, E> of(
            BiFunction<? super C, ? super S, Decision<E>> decide,
            BiFunction<? super S, ? super E, ? extends S> evolve,
            Supplier<? extends S> initialState) {
        Objects.requireNonNull(decide, "decide");
        Objects.requireNonNull(evolve, "evolve");
        Objects.requireNonNull(initialState, "initialState");
        return new Decider<>() {
            @Override
            public Decision<E> decide(C command, S state) {
                return decide.apply(command, state);
            }

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
     * Combines two deciders into one operating on a pair of states.
     *
     * <p>A command is routed to the decider whose command type it is an instance of; an event
     * evolves only the side whose event type it belongs to, the other side is left unchanged.
     * The combined decider is as pure as its parts.
     *
     * @param left              the first decider
     * @param leftCommandType   command class handled by {@code left}
     * @param leftEventType     event class produced by {@code left}
     * @param right             the second decider
     * @param rightCommandType  command class handled by {@code right}
     * @param rightEventType    event class produced by {@code right}
     * @param <C>               common command supertype
     * @param <E>               common event supertype
     * @return the combined decider
     */
    static <C, E, C1 extends C, S1, E1 extends E, C2 extends C, S2, E2 extends E>
    Decider<C, CombinedState<S1, S2>, E> combine(
            Decider<C1, S1, E1> left, Class<C1> leftCommandType, Class<E1> leftEventType,
            Decider<C2, S2, E2> right, Class<C2> rightCommandType, Class<E2> rightEventType) {
        return new CombinedDecider<>(left, leftCommandType, leftEventType,
                right, rightCommandType, rightEventType);
    }
}
