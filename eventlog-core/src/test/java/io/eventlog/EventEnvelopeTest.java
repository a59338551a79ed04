package io.eventlog;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventEnvelopeTest {

    @Test
    void builderCreatesEnvelopeWithDefaults() {
        EventEnvelope envelope = EventEnvelope.builder("TodoCreated")
                .payloadJson("{\"id\":\"t-1\"}")
                .build();

        assertNotNull(envelope.eventId());
        assertEquals(26, envelope.eventId().length()); // ULID format
        assertEquals("TodoCreated", envelope.eventType());
        assertEquals(1, envelope.schemaVersion());
        assertNotNull(envelope.occurredAt());
        assertEquals(0, envelope.occurredAt().getNano() % 1_000_000, "occurredAt is truncated to millis");
        assertTrue(envelope.metadata().isEmpty());
        assertEquals("{\"id\":\"t-1\"}", envelope.payloadJson());
    }

    @Test
    void builderAcceptsAllFields() {
        Instant now = Instant.parse("2024-05-01T10:15:30.123Z");

        EventEnvelope envelope = EventEnvelope.builder("TodoCompleted")
                .eventId("custom-id")
                .schemaVersion(3)
                .occurredAt(now)
                .metadata(Map.of(MetadataKeys.CORRELATION_ID, "corr-1"))
                .payloadJson("{}")
                .build();

        assertEquals("custom-id", envelope.eventId());
        assertEquals(3, envelope.schemaVersion());
        assertEquals(now, envelope.occurredAt());
        assertEquals("corr-1", envelope.metadata().get(MetadataKeys.CORRELATION_ID));
    }

    @Test
    void eventIdsAreUnique() {
        EventEnvelope first = EventEnvelope.ofJson("A", "{}");
        EventEnvelope second = EventEnvelope.ofJson("A", "{}");

        assertNotEquals(first.eventId(), second.eventId());
    }

    @Test
    void payloadBytesAreCopied() {
        byte[] payload = "{\"x\":1}".getBytes(StandardCharsets.UTF_8);

        EventEnvelope envelope = EventEnvelope.builder("A").payloadBytes(payload).build();
        payload[0] = 'X';
        envelope.payload()[1] = 'Y';

        assertArrayEquals("{\"x\":1}".getBytes(StandardCharsets.UTF_8), envelope.payload());
    }

    @Test
    void metadataIsCopiedAndUnmodifiable() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("k", "v");

        EventEnvelope envelope = EventEnvelope.builder("A").metadata(metadata).payloadJson("{}").build();
        metadata.put("k2", "v2");

        assertEquals(1, envelope.metadata().size());
        assertThrows(UnsupportedOperationException.class, () -> envelope.metadata().put("x", "y"));
    }

    @Test
    void nullMetadataValueRejected() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("k", null);

        assertThrows(IllegalArgumentException.class, () ->
                EventEnvelope.builder("A").metadata(metadata).payloadJson("{}").build());
    }

    @Test
    void missingPayloadRejected() {
        assertThrows(IllegalArgumentException.class, () -> EventEnvelope.builder("A").build());
    }

    @Test
    void bothPayloadsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                EventEnvelope.builder("A").payloadJson("{}").payloadBytes(new byte[0]).build());
    }

    @Test
    void oversizedPayloadRejected() {
        byte[] payload = new byte[EventEnvelope.MAX_PAYLOAD_BYTES + 1];

        assertThrows(IllegalArgumentException.class, () ->
                EventEnvelope.builder("A").payloadBytes(payload).build());
    }

    @Test
    void emptyEventTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> EventEnvelope.ofJson("", "{}"));
        assertThrows(NullPointerException.class, () -> EventEnvelope.ofJson(null, "{}"));
    }

    @Test
    void schemaVersionBelowOneRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                EventEnvelope.builder("A").schemaVersion(0).payloadJson("{}").build());
    }
}
