package io.eventlog.decider;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Decider#decide}.
 *
 * <p>{@link Accepted} carries the events to append; an empty list means the command was a
 * valid no-op (idempotent repeat). {@link Rejected} signals a validation error: nothing is
 * appended and the caller receives the reason synchronously.
 *
 * @param <E> the event type
 */
public sealed interface Decision<E> permits Decision.Accepted, Decision.Rejected {

    /**
     * Accepts the command, producing the given events.
     *
     * @param events the events, in order
     * @param <E>    the event type
     * @return an accepted decision
     */
    @SafeVarargs
    static <E> Decision<E> accept(E... events) {
        return new Accepted<>(List.of(events));
    }

    /**
     * Accepts the command, producing the given events.
     *
     * @param events the events, in order
     * @param <E>    the event type
     * @return an accepted decision
     */
    static <E> Decision<E> accept(List<? extends E> events) {
        return new Accepted<>(List.copyOf(events));
    }

    /**
     * Accepts the command without producing any event.
     *
     * @param <E> the event type
     * @return an accepted, empty decision
     */
    static <E> Decision<E> noChange() {
        return new Accepted<>(List.of());
    }

    /**
     * Rejects the command.
     *
     * @param code    stable machine-readable reason
     * @param message human-readable description
     * @param <E>     the event type
     * @return a rejected decision
     */
    static <E> Decision<E> reject(String code, String message) {
        return new Rejected<>(code, message);
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /** Command accepted; {@code events} may be empty. */
    record Accepted<E>(List<E> events) implements Decision<E> {
        public Accepted {
            events = List.copyOf(Objects.requireNonNull(events, "events"));
        }
    }

    /** Command rejected with a validation error. */
    record Rejected<E>(String code, String message) implements Decision<E> {
        public Rejected {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }
}
