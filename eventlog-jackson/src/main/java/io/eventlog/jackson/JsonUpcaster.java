package io.eventlog.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventlog.EventCodecException;
import io.eventlog.upcast.Upcaster;

import java.io.IOException;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * {@link Upcaster} that edits the payload as a Jackson {@link ObjectNode} tree, so renamed
 * or added fields can be handled without binding to the old event class.
 *
 * <pre>{@code
 * Upcaster upcaster = JsonUpcaster.of("TodoCreated", 1, node -> node.put("priority", "normal"));
 * }</pre>
 */
public abstract class JsonUpcaster implements Upcaster {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String eventType;
  private final int sourceVersion;

  protected JsonUpcaster(String eventType, int sourceVersion) {
    this.eventType = Objects.requireNonNull(eventType, "eventType");
    if (sourceVersion < 1) {
      throw new IllegalArgumentException("sourceVersion must be >= 1, got: " + sourceVersion);
    }
    this.sourceVersion = sourceVersion;
  }

  public static JsonUpcaster of(String eventType, int sourceVersion, UnaryOperator<ObjectNode> upgrade) {
    Objects.requireNonNull(upgrade, "upgrade");
    return new JsonUpcaster(eventType, sourceVersion) {
      @Override
      protected ObjectNode upgrade(ObjectNode payload) {
        return upgrade.apply(payload);
      }
    };
  }

  @Override
  public final String eventType() {
    return eventType;
  }

  @Override
  public final int sourceVersion() {
    return sourceVersion;
  }

  /**
   * Transforms the payload tree. May mutate and return {@code payload}.
   */
  protected abstract ObjectNode upgrade(ObjectNode payload);

  @Override
  public final byte[] transform(byte[] payload) {
    JsonNode tree;
    try {
      tree = MAPPER.readTree(payload);
    } catch (IOException e) {
      throw new EventCodecException("Malformed " + eventType + " v" + sourceVersion + " payload", e);
    }
    if (!(tree instanceof ObjectNode object)) {
      throw new EventCodecException(eventType + " v" + sourceVersion + " payload is not a JSON object");
    }
    ObjectNode upgraded = upgrade(object);
    if (upgraded == null) {
      throw new IllegalStateException("Upcaster for " + eventType + " v" + sourceVersion + " returned null");
    }
    try {
      return MAPPER.writeValueAsBytes(upgraded);
    } catch (IOException e) {
      throw new EventCodecException("Failed to write upgraded " + eventType + " payload", e);
    }
  }
}
