package io.eventlog.decider;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Given-when-then harness for testing a {@link Decider} without any infrastructure.
 *
 * <pre>{@code
 * DeciderSpecification.of(new TodoDecider())
 *     .given(new TodoEvent.Created("t-1", "milk", now))
 *     .when(new TodoCommand.Complete("t-1", now))
 *     .thenEvents(new TodoEvent.Completed("t-1", now));
 * }</pre>
 *
 * <p>Failures are reported as {@link AssertionError}, so the harness works with any test
 * framework.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public final class DeciderSpecification<C, S, E> {
    private final Decider<C, S, E> decider;
    private final List<E> given;

    private DeciderSpecification(Decider<C, S, E> decider, List<E> given) {
        this.decider = decider;
        this.given = given;
    }

    public static <C, S, E> DeciderSpecification<C, S, E> of(Decider<C, S, E> decider) {
        return new DeciderSpecification<>(Objects.requireNonNull(decider, "decider"), List.of());
    }

    /**
     * Sets the prior events of the aggregate.
     *
     * @param events prior events, in order
     * @return a specification with the given history
     */
    @SafeVarargs
    public final DeciderSpecification<C, S, E> given(E... events) {
        return new DeciderSpecification<>(decider, List.of(events));
    }

    /**
     * Runs the command against the folded history.
     *
     * @param command the command
     * @return the outcome to assert on
     */
    public Outcome<S, E> when(C command) {
        S state = decider.fold(given);
        return new Outcome<>(decider.decide(command, state), state);
    }

    /**
     * Folds the history and returns the resulting state.
     *
     * @return the state after the given events
     */
    public S thenState() {
        return decider.fold(given);
    }

    /** Result of a {@link DeciderSpecification#when} step. */
    public static final class Outcome<S, E> {
        private final Decision<E> decision;
        private final S state;

        private Outcome(Decision<E> decision, S state) {
            this.decision = Objects.requireNonNull(decision, "decide returned null");
            this.state = state;
        }

        /**
         * Asserts the command was accepted with exactly these events.
         *
         * @param expected the expected events; none for an idempotent no-op
         * @return the produced events
         */
        @SafeVarargs
        public final List<E> thenEvents(E... expected) {
            if (!(decision instanceof Decision.Accepted<E> accepted)) {
                throw new AssertionError("Expected events " + Arrays.asList(expected) + " but was " + decision);
            }
            if (!accepted.events().equals(List.of(expected))) {
                throw new AssertionError("Expected events " + Arrays.asList(expected) + " but was " + accepted.events());
            }
            return accepted.events();
        }

        /**
         * Asserts the command was accepted without events.
         */
        public void thenNoChange() {
            thenEvents();
        }

        /**
         * Asserts the command was rejected with the given code.
         *
         * @param expectedCode the expected rejection code
         * @return the rejection
         */
        public Decision.Rejected<E> thenRejected(String expectedCode) {
            if (!(decision instanceof Decision.Rejected<E> rejected)) {
                throw new AssertionError("Expected rejection " + expectedCode + " but was " + decision);
            }
            if (!rejected.code().equals(expectedCode)) {
                throw new AssertionError("Expected rejection " + expectedCode + " but was " + rejected.code()
                        + " (" + rejected.message() + ")");
            }
            return rejected;
        }

        public Decision<E> decision() {
            return decision;
        }

        /**
         * Returns the state the command was decided against.
         *
         * @return the folded state
         */
        public S state() {
            return state;
        }
    }
}
