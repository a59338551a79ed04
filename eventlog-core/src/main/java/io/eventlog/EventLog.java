package io.eventlog;

import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only, totally ordered log of domain events; the single source of truth.
 *
 * <p>Every event receives a store-wide {@code globalSequence} that is gapless and
 * monotonically increasing in commit order, and a per-aggregate {@code aggregateSequence}
 * that is gapless within one {@code (aggregateType, aggregateId)} stream. Rows are never
 * updated or deleted, except by the administrative {@link #purge()}.
 *
 * <p>Reads apply the configured {@link io.eventlog.upcast.UpcasterChain}, so callers always
 * see the current schema version of each event type.
 *
 * @see io.eventlog.memory.InMemoryEventLog
 */
public interface EventLog {

    /**
     * Atomically appends a batch of events to one aggregate's stream.
     *
     * <p>The append succeeds only if the aggregate's current version (its highest
     * {@code aggregateSequence}, {@code 0} when the stream is empty) equals
     * {@code expectedVersion}. Either every event of the batch is stored or none is.
     *
     * @param aggregateType   the aggregate type
     * @param aggregateId     the aggregate instance identifier
     * @param expectedVersion the version the caller's decision was based on
     * @param events          the events to append, in order; an empty list stores nothing
     * @return the assigned global sequences, in input order
     * @throws ConcurrencyConflictException if the current version differs from {@code expectedVersion}
     * @throws EventLogStoreException       if the storage layer fails
     */
    List<Long> append(String aggregateType, String aggregateId, long expectedVersion,
            List<EventEnvelope> events);

    /**
     * Loads all events of one aggregate in ascending {@code aggregateSequence} order.
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate instance identifier
     * @return the aggregate's events; empty when the aggregate does not exist
     */
    List<StoredEvent> load(String aggregateType, String aggregateId);

    /**
     * Returns every event with {@code globalSequence} strictly greater than the cursor,
     * in ascending {@code globalSequence} order. Used for SSE replay.
     *
     * @param globalSequence the exclusive lower bound; {@code 0} returns the whole log
     * @return the matching events
     */
    default List<StoredEvent> querySince(long globalSequence) {
        return querySince(globalSequence, Integer.MAX_VALUE);
    }

    /**
     * Page-wise variant of {@link #querySince(long)}.
     *
     * @param globalSequence the exclusive lower bound
     * @param limit          maximum number of events to return, must be &gt; 0
     * @return at most {@code limit} events in ascending {@code globalSequence} order
     */
    List<StoredEvent> querySince(long globalSequence, int limit);

    /**
     * Returns the aggregate's current version: its highest {@code aggregateSequence},
     * or {@code 0} when no event exists.
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate instance identifier
     * @return the current version
     */
    long currentVersion(String aggregateType, String aggregateId);

    /**
     * Returns the lowest stored global sequence, empty when the log is empty.
     *
     * @return the earliest global sequence
     */
    OptionalLong earliestSequence();

    /**
     * Returns the highest stored global sequence, empty when the log is empty.
     *
     * @return the latest global sequence
     */
    OptionalLong latestSequence();

    /**
     * Deletes every event and resets the global sequence. Administrative use in test
     * environments only.
     *
     * @return the number of deleted events
     */
    int purge();
}
