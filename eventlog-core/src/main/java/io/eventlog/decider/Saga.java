package io.eventlog.decider;

import java.util.List;

/**
 * Pure reaction from an event of one aggregate to commands for other aggregates.
 *
 * <p>A saga only computes commands; the runtime dispatches them through the
 * {@link io.eventlog.runtime.CommandGateway} after the triggering event is persisted.
 *
 * @param <E> the event type reacted to
 * @param <A> the command type produced
 */
@FunctionalInterface
public interface Saga<E, A> {

    /**
     * Computes the commands caused by an event.
     *
     * @param event the persisted event
     * @return commands to dispatch, possibly empty
     */
    List<A> react(E event);
}
