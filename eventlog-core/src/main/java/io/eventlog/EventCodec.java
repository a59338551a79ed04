package io.eventlog;

import java.util.Map;

/**
 * Converts typed domain events to and from their persisted form.
 *
 * <p>{@link #decode} receives events that already passed the upcaster chain, so it only
 * needs to understand the current schema version of each event type.
 *
 * @param <E> the domain event type
 */
public interface EventCodec<E> {

    /**
     * Encodes a domain event.
     *
     * @param event    the domain event
     * @param metadata metadata to attach (correlation, causation, actor)
     * @return the envelope to append
     * @throws EventCodecException if the event cannot be serialized
     */
    EventEnvelope encode(E event, Map<String, String> metadata);

    /**
     * Decodes a stored event.
     *
     * @param event the stored, upcasted event
     * @return the domain event
     * @throws EventCodecException if the type is unknown or the payload is malformed
     */
    E decode(StoredEvent event);
}
