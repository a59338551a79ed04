package io.eventlog;

/**
 * Unchecked exception wrapping storage-layer failures (JDBC errors, I/O).
 *
 * <p>{@link #isTransient()} marks failures where retrying the same operation may succeed,
 * such as serialization failures, deadlocks or lost connections. The aggregate runtime
 * retries transient failures with backoff up to a bound.
 */
public final class EventLogStoreException extends EventLogException {
    private final boolean transientFailure;

    public EventLogStoreException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public EventLogStoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
