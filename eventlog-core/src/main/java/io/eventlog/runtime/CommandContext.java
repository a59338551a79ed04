package io.eventlog.runtime;

import com.github.f4b6a3.ulid.UlidCreator;
import io.eventlog.MetadataKeys;
import io.eventlog.StoredEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request-scoped information travelling with a command and recorded in the metadata of
 * every event it produces.
 *
 * @param correlationId shared by all events of one request, including background follow-ups
 * @param causationId   what directly caused this command: a request id or an event id; may be null
 * @param actor         who issued the command; may be null
 * @param origin        whether a user or the system issued the command
 */
public record CommandContext(String correlationId, String causationId, String actor, Origin origin) {

  /** Who issued a command. */
  public enum Origin {
    USER,
    SYSTEM
  }

  public CommandContext {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(origin, "origin");
    if (correlationId.isEmpty()) {
      throw new IllegalArgumentException("correlationId cannot be empty");
    }
  }

  /**
   * Starts a new user request with a fresh ULID correlation id.
   *
   * @param actor the acting user, may be null
   * @return a new context
   */
  public static CommandContext user(String actor) {
    return new CommandContext(newCorrelationId(), null, actor, Origin.USER);
  }

  /**
   * Creates a system context continuing an existing correlation.
   *
   * @param correlationId the correlation to continue
   * @param causationId   the causing event or request id
   * @return a new context
   */
  public static CommandContext system(String correlationId, String causationId) {
    return new CommandContext(correlationId, causationId, "system", Origin.SYSTEM);
  }

  /**
   * Derives the context for a command caused by a persisted event, as issued by sagas.
   *
   * @param event the causing event
   * @return a system context with the same correlation id and the event as cause
   */
  public CommandContext causedBy(StoredEvent event) {
    return new CommandContext(correlationId, event.eventId(), "system", Origin.SYSTEM);
  }

  public static String newCorrelationId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Renders this context as event metadata.
   *
   * @param commandType simple name of the command class
   * @return metadata entries, without null values
   */
  public Map<String, String> toMetadata(String commandType) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(MetadataKeys.CORRELATION_ID, correlationId);
    if (causationId != null) {
      metadata.put(MetadataKeys.CAUSATION_ID, causationId);
    }
    if (actor != null) {
      metadata.put(MetadataKeys.ACTOR, actor);
    }
    if (commandType != null) {
      metadata.put(MetadataKeys.COMMAND_TYPE, commandType);
    }
    return metadata;
  }
}
