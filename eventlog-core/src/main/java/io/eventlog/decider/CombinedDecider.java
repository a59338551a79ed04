package io.eventlog.decider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class CombinedDecider<C, E, C1 extends C, S1, E1 extends E, C2 extends C, S2, E2 extends E>
        implements Decider<C, CombinedState<S1, S2>, E> {

    private final Decider<C1, S1, E1> left;
    private final Class<C1> leftCommandType;
    private final Class<E1> leftEventType;
    private final Decider<C2, S2, E2> right;
    private final Class<C2> rightCommandType;
    private final Class<E2> rightEventType;

    CombinedDecider(Decider<C1, S1, E1> left, Class<C1> leftCommandType, Class<E1> leftEventType,
            Decider<C2, S2, E2> right, Class<C2> rightCommandType, Class<E2> rightEventType) {
        this.left = Objects.requireNonNull(left, "left");
        this.leftCommandType = Objects.requireNonNull(leftCommandType, "leftCommandType");
        this.leftEventType = Objects.requireNonNull(leftEventType, "leftEventType");
        this.right = Objects.requireNonNull(right, "right");
        this.rightCommandType = Objects.requireNonNull(rightCommandType, "rightCommandType");
        this.rightEventType = Objects.requireNonNull(rightEventType, "rightEventType");
    }

    @Override
    public Decision<E> decide(C command, CombinedState<S1, S2> state) {
        if (leftCommandType.isInstance(command)) {
            return widen(left.decide(leftCommandType.cast(command), state.left()));
        }
        if (rightCommandType.isInstance(command)) {
            return widen(right.decide(rightCommandType.cast(command), state.right()));
        }
        throw new IllegalArgumentException("No decider handles command " + command.getClass().getName());
    }

    @Override
    public CombinedState<S1, S2> evolve(CombinedState<S1, S2> state, E event) {
        if (leftEventType.isInstance(event)) {
            return state.withLeft(left.evolve(state.left(), leftEventType.cast(event)));
        }
        if (rightEventType.isInstance(event)) {
            return state.withRight(right.evolve(state.right(), rightEventType.cast(event)));
        }
        return state;
    }

    @Override
    public CombinedState<S1, S2> initialState() {
        return new CombinedState<>(left.initialState(), right.initialState());
    }

    private static <E, X extends E> Decision<E> widen(Decision<X> decision) {
        if (decision instanceof Decision.Rejected<X> rejected) {
            return Decision.reject(rejected.code(), rejected.message());
        }
        return Decision.accept(new ArrayList<E>(((Decision.Accepted<X>) decision).events()));
    }
}
