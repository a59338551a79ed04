package io.eventlog;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only record of a persisted event, as returned by {@link EventLog#load} and
 * {@link EventLog#querySince}.
 *
 * <p>{@code globalSequence} is the store-wide position and the SSE resumption token;
 * {@code aggregateSequence} is the 1-based position inside one aggregate's stream and equals
 * the aggregate version after the event is applied. Equality compares payload content.
 */
public record StoredEvent(
    long globalSequence,
    String eventId,
    String aggregateType,
    String aggregateId,
    long aggregateSequence,
    String eventType,
    int schemaVersion,
    byte[] payload,
    Map<String, String> metadata,
    Instant createdAt
) {

    public StoredEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Returns the payload decoded as UTF-8 text.
     *
     * @return the payload as a string
     */
    public String payloadJson() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Returns a copy of this event carrying a different payload and schema version.
     * Used by the upcaster chain; the persisted row is never touched.
     *
     * @param newSchemaVersion the schema version of {@code newPayload}
     * @param newPayload       the transformed payload
     * @return the upgraded event
     */
    public StoredEvent withPayload(int newSchemaVersion, byte[] newPayload) {
        return new StoredEvent(globalSequence, eventId, aggregateType, aggregateId,
            aggregateSequence, eventType, newSchemaVersion, newPayload, metadata, createdAt);
    }

    /**
     * Returns a metadata entry, or {@code null} when absent.
     *
     * @param key the metadata key, see {@link MetadataKeys}
     * @return the value or {@code null}
     */
    public String metadataValue(String key) {
        return metadata.get(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredEvent that)) return false;
        return globalSequence == that.globalSequence
            && aggregateSequence == that.aggregateSequence
            && schemaVersion == that.schemaVersion
            && eventId.equals(that.eventId)
            && aggregateType.equals(that.aggregateType)
            && aggregateId.equals(that.aggregateId)
            && eventType.equals(that.eventType)
            && Arrays.equals(payload, that.payload)
            && metadata.equals(that.metadata)
            && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(globalSequence, eventId, aggregateType, aggregateId,
            aggregateSequence, eventType, schemaVersion, metadata, createdAt);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "StoredEvent{globalSequence=" + globalSequence
            + ", eventId=" + eventId
            + ", aggregate=" + aggregateType + '/' + aggregateId
            + ", aggregateSequence=" + aggregateSequence
            + ", eventType=" + eventType
            + ", schemaVersion=" + schemaVersion + '}';
    }
}
