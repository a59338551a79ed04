package io.eventlog.spi;

/**
 * Observability hook for exporting event log counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events appended to the log.
     *
     * @param count number of events in the committed batch
     */
    void incrementEventsAppended(int count);

    /**
     * Increments the count of appends rejected with a concurrency conflict.
     */
    void incrementConflicts();

    /**
     * Increments the count of commands rejected by a decider.
     */
    void incrementCommandsRejected();

    /**
     * Increments the count of command re-executions after a conflict or transient storage failure.
     */
    default void incrementCommandRetries() {
    }

    /**
     * Records the time spent handling one command, from load to publish.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordCommandDurationMs(long durationMs) {
    }

    /**
     * Increments the count of events handed to a bus subscriber buffer.
     */
    void incrementBusDelivered();

    /**
     * Increments the count of events discarded because a subscriber buffer overflowed.
     */
    void incrementBusDropped();

    /**
     * Increments the count of failed post-commit publications.
     */
    default void incrementPublishFailures() {
    }

    /**
     * Records the number of live bus subscriptions.
     *
     * @param subscribers current subscriber count
     */
    void recordSubscriberCount(int subscribers);

    /**
     * Records the highest global sequence known to be committed.
     *
     * @param globalSequence the latest global sequence
     */
    default void recordLatestSequence(long globalSequence) {
    }

    /**
     * Increments the count of detached background tasks started.
     */
    default void incrementTasksStarted() {
    }

    /**
     * Increments the count of detached background tasks that reached a terminal outcome.
     */
    default void incrementTasksTerminated() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsAppended(int count) {
        }

        @Override
        public void incrementConflicts() {
        }

        @Override
        public void incrementCommandsRejected() {
        }

        @Override
        public void incrementBusDelivered() {
        }

        @Override
        public void incrementBusDropped() {
        }

        @Override
        public void recordSubscriberCount(int subscribers) {
        }
    }
}
