package io.eventlog;

/**
 * Represents an aggregate type identifier.
 *
 * <p>Implementations are usually enums for compile-time safety:
 * <pre>{@code
 * public enum Aggregates implements AggregateType {
 *   TODO,
 *   QUERY_SESSION
 * }
 * }</pre>
 *
 * <p>The name is persisted with every event and forms the second segment of the
 * distribution key {@code events/{aggregateType}/{aggregateId}}, so it must not contain
 * {@code '/'} or {@code '*'}.
 */
public interface AggregateType {

    /**
     * Returns the string representation of this aggregate type.
     * This value is persisted to the database.
     *
     * @return the aggregate type name, never null
     */
    String name();

    /**
     * Creates an aggregate type for a dynamic name.
     *
     * @param name the aggregate type name
     * @return an aggregate type returning {@code name}
     */
    static AggregateType of(String name) {
        java.util.Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        return new AggregateType() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
