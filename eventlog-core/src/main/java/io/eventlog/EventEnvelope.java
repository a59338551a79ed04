package io.eventlog;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, not-yet-persisted event handed to {@link EventLog#append}.
 *
 * <p>Each envelope is assigned a ULID-based {@code eventId} by default. The payload
 * (JSON string or raw bytes) is limited to {@value #MAX_PAYLOAD_BYTES} bytes and is opaque
 * to the log. The aggregate identity and both sequence numbers are assigned by the log when
 * the envelope is appended, turning it into a {@link StoredEvent}.
 *
 * @see EventCodec
 * @see StoredEvent
 */
public final class EventEnvelope {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private final String eventId;
    private final String eventType;
    private final int schemaVersion;
    private final Instant occurredAt;
    private final Map<String, String> metadata;
    private final byte[] payload;

    private EventEnvelope(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        if (builder.schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + builder.schemaVersion);
        }
        this.schemaVersion = builder.schemaVersion;
        this.occurredAt = builder.occurredAt == null
                ? Instant.now().truncatedTo(ChronoUnit.MILLIS) : builder.occurredAt;

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys");
        }
        if (metadataCopy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null values");
        }
        this.metadata = metadataCopy;

        if (builder.payloadJson == null && builder.payloadBytes == null) {
            throw new IllegalArgumentException("payloadJson or payloadBytes must be set");
        }
        if (builder.payloadJson != null && builder.payloadBytes != null) {
            throw new IllegalArgumentException("Set either payloadJson or payloadBytes, not both");
        }
        byte[] bytes = builder.payloadJson != null
                ? builder.payloadJson.getBytes(StandardCharsets.UTF_8)
                : Arrays.copyOf(builder.payloadBytes, builder.payloadBytes.length);
        if (bytes.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payload = bytes;
    }

    /**
     * Creates a builder for the given event type.
     *
     * @param eventType the event type name, e.g. {@code "ItemCreated"}
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Creates a schema version 1 envelope with a JSON payload.
     *
     * @param eventType   the event type name
     * @param payloadJson the JSON payload
     * @return a new envelope
     */
    public static EventEnvelope ofJson(String eventType, String payloadJson) {
        return builder(eventType).payloadJson(payloadJson).build();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    /**
     * Returns the payload decoded as UTF-8 text.
     *
     * @return the payload as a string
     */
    public String payloadJson() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "EventEnvelope{eventId=" + eventId
                + ", eventType=" + eventType
                + ", schemaVersion=" + schemaVersion + '}';
    }

    /**
     * Builder for {@link EventEnvelope}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private int schemaVersion = 1;
        private Instant occurredAt;
        private Map<String, String> metadata;
        private String payloadJson;
        private byte[] payloadBytes;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the schema version the payload is written in.
         *
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         *
         * @param schemaVersion the payload schema version
         * @return this builder
         */
        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        /**
         * Sets the event timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()} truncated to milliseconds. The log
         * stores this instant as the event's {@code createdAt}.
         *
         * @param occurredAt the event timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Sets flat key-value metadata (correlation id, causation id, actor). The map is
         * defensively copied at build time.
         *
         * <p>Optional. Defaults to an empty map. Null keys and values are rejected at build time.
         *
         * @param metadata the metadata entries
         * @return this builder
         * @see MetadataKeys
         */
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the event payload as a JSON string. Mutually exclusive with {@link #payloadBytes}.
         *
         * @param payloadJson the JSON payload
         * @return this builder
         */
        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Sets the event payload as raw bytes. Mutually exclusive with {@link #payloadJson}.
         *
         * @param payloadBytes the raw byte payload
         * @return this builder
         */
        public Builder payloadBytes(byte[] payloadBytes) {
            this.payloadBytes = payloadBytes;
            return this;
        }

        /**
         * Builds an immutable {@link EventEnvelope}.
         *
         * @return a new event envelope
         * @throws IllegalArgumentException if neither payload is set, both payloads are set,
         *                                  the payload exceeds {@value EventEnvelope#MAX_PAYLOAD_BYTES} bytes,
         *                                  {@code eventType} is empty, {@code schemaVersion} is
         *                                  below 1, or metadata contains nulls
         */
        public EventEnvelope build() {
            return new EventEnvelope(this);
        }
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
