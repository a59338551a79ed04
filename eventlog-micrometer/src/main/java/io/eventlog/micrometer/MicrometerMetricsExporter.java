package io.eventlog.micrometer;

import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventlog.append.events} — events committed to the log</li>
 *   <li>{@code eventlog.append.conflicts} — appends rejected with a version conflict</li>
 *   <li>{@code eventlog.command.rejected} — commands rejected by a decider</li>
 *   <li>{@code eventlog.command.retries} — command re-executions</li>
 *   <li>{@code eventlog.bus.delivered} — events buffered for a subscriber</li>
 *   <li>{@code eventlog.bus.dropped} — events lost to subscriber overflow</li>
 *   <li>{@code eventlog.bus.publish.failures} — failed post-commit publications</li>
 *   <li>{@code eventlog.tasks.started} — detached tasks started</li>
 *   <li>{@code eventlog.tasks.terminal} — detached tasks that reached a terminal outcome</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventlog.bus.subscribers} — live bus subscriptions</li>
 *   <li>{@code eventlog.log.latest.sequence} — highest committed global sequence</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code eventlog.command.duration.ms} — command handling time, load to publish</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter eventsAppended;
    private final Counter conflicts;
    private final Counter commandsRejected;
    private final Counter commandRetries;
    private final Counter busDelivered;
    private final Counter busDropped;
    private final Counter publishFailures;
    private final Counter tasksStarted;
    private final Counter tasksTerminated;
    private final Gauge subscribersGauge;
    private final Gauge latestSequenceGauge;
    private final DistributionSummary commandDuration;

    private final AtomicInteger subscribers = new AtomicInteger();
    private final AtomicLong latestSequence = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "eventlog"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "eventlog");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "todo.eventlog"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.eventsAppended = Counter.builder(namePrefix + ".append.events")
                .description("Events committed to the log")
                .register(registry);
        this.conflicts = Counter.builder(namePrefix + ".append.conflicts")
                .description("Appends rejected with a concurrency conflict")
                .register(registry);
        this.commandsRejected = Counter.builder(namePrefix + ".command.rejected")
                .description("Commands rejected by a decider")
                .register(registry);
        this.commandRetries = Counter.builder(namePrefix + ".command.retries")
                .description("Command re-executions after a conflict or transient storage failure")
                .register(registry);
        this.busDelivered = Counter.builder(namePrefix + ".bus.delivered")
                .description("Events handed to a subscriber buffer")
                .register(registry);
        this.busDropped = Counter.builder(namePrefix + ".bus.dropped")
                .description("Events discarded on subscriber buffer overflow")
                .register(registry);
        this.publishFailures = Counter.builder(namePrefix + ".bus.publish.failures")
                .description("Failed post-commit publications")
                .register(registry);
        this.tasksStarted = Counter.builder(namePrefix + ".tasks.started")
                .description("Detached background tasks started")
                .register(registry);
        this.tasksTerminated = Counter.builder(namePrefix + ".tasks.terminal")
                .description("Detached background tasks that reached a terminal outcome")
                .register(registry);

        this.subscribersGauge = Gauge.builder(namePrefix + ".bus.subscribers", subscribers, AtomicInteger::get)
                .register(registry);
        this.latestSequenceGauge = Gauge.builder(namePrefix + ".log.latest.sequence", latestSequence, AtomicLong::get)
                .register(registry);

        this.commandDuration = DistributionSummary.builder(namePrefix + ".command.duration.ms")
                .description("Command handling time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEventsAppended(int count) {
        if (closed) return;
        eventsAppended.increment(count);
    }

    @Override
    public void incrementConflicts() {
        if (closed) return;
        conflicts.increment();
    }

    @Override
    public void incrementCommandsRejected() {
        if (closed) return;
        commandsRejected.increment();
    }

    @Override
    public void incrementCommandRetries() {
        if (closed) return;
        commandRetries.increment();
    }

    @Override
    public void recordCommandDurationMs(long durationMs) {
        if (closed) return;
        commandDuration.record(durationMs);
    }

    @Override
    public void incrementBusDelivered() {
        if (closed) return;
        busDelivered.increment();
    }

    @Override
    public void incrementBusDropped() {
        if (closed) return;
        busDropped.increment();
    }

    @Override
    public void incrementPublishFailures() {
        if (closed) return;
        publishFailures.increment();
    }

    @Override
    public void recordSubscriberCount(int subscribers) {
        if (closed) return;
        this.subscribers.set(subscribers);
    }

    @Override
    public void recordLatestSequence(long globalSequence) {
        if (closed) return;
        latestSequence.accumulateAndGet(globalSequence, Math::max);
    }

    @Override
    public void incrementTasksStarted() {
        if (closed) return;
        tasksStarted.increment();
    }

    @Override
    public void incrementTasksTerminated() {
        if (closed) return;
        tasksTerminated.increment();
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(eventsAppended, conflicts, commandsRejected, commandRetries,
                busDelivered, busDropped, publishFailures, tasksStarted, tasksTerminated,
                subscribersGauge, latestSequenceGauge, commandDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
