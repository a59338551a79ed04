package io.eventlog.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.eventlog.EventCodec;
import io.eventlog.EventCodecException;
import io.eventlog.EventEnvelope;
import io.eventlog.StoredEvent;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link EventCodec} serializing domain events as JSON with Jackson.
 *
 * <p>Each concrete event class is registered under a stable event type name together with
 * the schema version it is currently written in. {@link #decode} expects events that have
 * already passed the upcaster chain and rejects any other version.
 *
 * <pre>{@code
 * JacksonEventCodec<TodoEvent> codec = JacksonEventCodec.builder(TodoEvent.class)
 *     .register("TodoCreated", TodoCreated.class)
 *     .register("TodoTextUpdated", TodoTextUpdated.class, 2)
 *     .build();
 * }</pre>
 *
 * @param <E> the domain event base type, usually a sealed interface of records
 */
public final class JacksonEventCodec<E> implements EventCodec<E> {
  private final ObjectMapper mapper;
  private final Map<String, Registration<? extends E>> byType;
  private final Map<Class<?>, Registration<? extends E>> byClass;

  private JacksonEventCodec(Builder<E> builder) {
    this.mapper = builder.mapper != null ? builder.mapper : defaultMapper();
    this.byType = Map.copyOf(builder.byType);
    Map<Class<?>, Registration<? extends E>> classes = new LinkedHashMap<>();
    for (Registration<? extends E> registration : builder.byType.values()) {
      classes.put(registration.eventClass(), registration);
    }
    this.byClass = Map.copyOf(classes);
  }

  public static <E> Builder<E> builder(Class<E> baseType) {
    return new Builder<>(baseType);
  }

  /**
   * Mapper used when none is configured: JSR-310 types as ISO-8601 strings, unknown
   * properties ignored so added fields never break older readers.
   */
  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  /** Event type name an event class was registered under. */
  public String eventTypeOf(Class<?> eventClass) {
    Registration<? extends E> registration = byClass.get(eventClass);
    if (registration == null) {
      throw new EventCodecException("Unregistered event class: " + eventClass.getName());
    }
    return registration.eventType();
  }

  /** Current schema version of an event type. */
  public int currentVersion(String eventType) {
    Registration<? extends E> registration = byType.get(eventType);
    if (registration == null) {
      throw new EventCodecException("Unknown event type: " + eventType);
    }
    return registration.schemaVersion();
  }

  @Override
  public EventEnvelope encode(E event, Map<String, String> metadata) {
    Objects.requireNonNull(event, "event");
    Registration<? extends E> registration = byClass.get(event.getClass());
    if (registration == null) {
      throw new EventCodecException("Unregistered event class: " + event.getClass().getName());
    }
    byte[] payload;
    try {
      payload = mapper.writeValueAsBytes(event);
    } catch (JsonProcessingException e) {
      throw new EventCodecException("Failed to serialize " + registration.eventType(), e);
    }
    return EventEnvelope.builder(registration.eventType())
        .schemaVersion(registration.schemaVersion())
        .metadata(metadata)
        .payloadBytes(payload)
        .build();
  }

  @Override
  public E decode(StoredEvent event) {
    Registration<? extends E> registration = byType.get(event.eventType());
    if (registration == null) {
      throw new EventCodecException("Unknown event type: " + event.eventType());
    }
    if (event.schemaVersion() != registration.schemaVersion()) {
      throw new EventCodecException("Event " + event.eventId() + " of type " + event.eventType()
          + " has schema version " + event.schemaVersion() + ", expected "
          + registration.schemaVersion() + "; is an upcaster missing?");
    }
    try {
      return mapper.readValue(event.payload(), registration.eventClass());
    } catch (IOException e) {
      throw new EventCodecException("Failed to deserialize " + event.eventType()
          + " event " + event.eventId(), e);
    }
  }

  private record Registration<T>(String eventType, Class<T> eventClass, int schemaVersion) {}

  /**
   * Builder for {@link JacksonEventCodec}.
   *
   * @param <E> the domain event base type
   */
  public static final class Builder<E> {
    private final Class<E> baseType;
    private final Map<String, Registration<? extends E>> byType = new LinkedHashMap<>();
    private ObjectMapper mapper;

    private Builder(Class<E> baseType) {
      this.baseType = Objects.requireNonNull(baseType, "baseType");
    }

    /**
     * Registers an event class at schema version 1.
     */
    public Builder<E> register(String eventType, Class<? extends E> eventClass) {
      return register(eventType, eventClass, 1);
    }

    /**
     * Registers an event class under a type name with the schema version new events are
     * written in.
     *
     * @throws IllegalArgumentException if the name or the class is already registered, or
     *                                  the version is below 1
     */
    public Builder<E> register(String eventType, Class<? extends E> eventClass, int schemaVersion) {
      Objects.requireNonNull(eventType, "eventType");
      Objects.requireNonNull(eventClass, "eventClass");
      if (eventType.isEmpty()) {
        throw new IllegalArgumentException("eventType cannot be empty");
      }
      if (schemaVersion < 1) {
        throw new IllegalArgumentException("schemaVersion must be >= 1, got: " + schemaVersion);
      }
      if (!baseType.isAssignableFrom(eventClass)) {
        throw new IllegalArgumentException(eventClass.getName() + " is not a " + baseType.getName());
      }
      if (byType.containsKey(eventType)) {
        throw new IllegalArgumentException("Duplicate event type: " + eventType);
      }
      if (byType.values().stream().anyMatch(r -> r.eventClass().equals(eventClass))) {
        throw new IllegalArgumentException("Event class already registered: " + eventClass.getName());
      }
      byType.put(eventType, new Registration<>(eventType, eventClass, schemaVersion));
      return this;
    }

    /**
     * Sets the Jackson mapper.
     *
     * <p>Optional. Defaults to {@link JacksonEventCodec#defaultMapper()}.
     */
    public Builder<E> objectMapper(ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    public JacksonEventCodec<E> build() {
      if (byType.isEmpty()) {
        throw new IllegalStateException("No event classes registered for " + baseType.getName());
      }
      return new JacksonEventCodec<>(this);
    }
  }
}
