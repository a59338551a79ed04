package io.eventlog.decider;

/**
 * State of a decider produced by {@link Decider#combine}.
 *
 * @param left  state of the first decider
 * @param right state of the second decider
 * @param <L>   first state type
 * @param <R>   second state type
 */
public record CombinedState<L, R>(L left, R right) {

    public CombinedState<L, R> withLeft(L newLeft) {
        return new CombinedState<>(newLeft, right);
    }

    public CombinedState<L, R> withRight(R newRight) {
        return new CombinedState<>(left, newRight);
    }
}
