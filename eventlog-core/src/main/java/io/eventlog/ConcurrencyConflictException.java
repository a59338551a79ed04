package io.eventlog;

/**
 * Thrown when an append's expected version does not match the aggregate's current version,
 * meaning another writer appended to the same aggregate after the caller loaded it.
 *
 * <p>Nothing of the rejected batch was stored. Whether to reload and retry is decided by the
 * command's {@link io.eventlog.runtime.ConflictPolicy}.
 */
public final class ConcurrencyConflictException extends EventLogException {
    private final String aggregateType;
    private final String aggregateId;
    private final long expected;
    private final long actual;

    public ConcurrencyConflictException(String aggregateType, String aggregateId, long expected, long actual) {
        super("Concurrency conflict on " + aggregateType + "/" + aggregateId
                + ": expected version " + expected + ", actual " + actual);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expected = expected;
        this.actual = actual;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
