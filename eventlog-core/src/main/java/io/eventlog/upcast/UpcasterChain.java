package io.eventlog.upcast;

import io.eventlog.StoredEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable collection of {@link Upcaster}s applied to events as they are read.
 *
 * <p>For each event the chain repeatedly picks, in registration order, the first upcaster
 * whose {@code (eventType, sourceVersion)} matches the event's current type and version and
 * applies it, until none matches. Several generations therefore chain (v1 to v2 to v3).
 * Events without a matching upcaster pass through unchanged.
 *
 * <pre>{@code
 * UpcasterChain chain = UpcasterChain.builder()
 *     .register(new ItemCreatedV1ToV2())
 *     .register(new ItemCreatedV2ToV3())
 *     .build();
 * }</pre>
 */
public final class UpcasterChain {
  public static final UpcasterChain EMPTY = new UpcasterChain(List.of());

  private final List<Upcaster> upcasters;

  private UpcasterChain(List<Upcaster> upcasters) {
    this.upcasters = List.copyOf(upcasters);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Upgrades an event to the newest schema version the chain knows.
   *
   * @param event the stored event
   * @return the upgraded event, or {@code event} itself when nothing applies
   */
  public StoredEvent upcast(StoredEvent event) {
    StoredEvent current = event;
    Upcaster next = find(current);
    while (next != null) {
      byte[] transformed = next.transform(current.payload());
      if (transformed == null) {
        throw new IllegalStateException("Upcaster returned null for "
            + next.eventType() + " v" + next.sourceVersion());
      }
      current = current.withPayload(next.targetVersion(), transformed);
      next = find(current);
    }
    return current;
  }

  /**
   * Upgrades every event of a list, preserving order.
   *
   * @param events stored events
   * @return upgraded events
   */
  public List<StoredEvent> upcastAll(List<StoredEvent> events) {
    if (upcasters.isEmpty()) {
      return events;
    }
    List<StoredEvent> result = new ArrayList<>(events.size());
    for (StoredEvent event : events) {
      result.add(upcast(event));
    }
    return result;
  }

  public List<Upcaster> upcasters() {
    return upcasters;
  }

  private Upcaster find(StoredEvent event) {
    for (Upcaster upcaster : upcasters) {
      if (upcaster.sourceVersion() == event.schemaVersion()
          && upcaster.eventType().equals(event.eventType())) {
        return upcaster;
      }
    }
    return null;
  }

  /** Builder for {@link UpcasterChain}. */
  public static final class Builder {
    private final List<Upcaster> upcasters = new ArrayList<>();

    private Builder() {}

    /**
     * Appends an upcaster. Registration order decides precedence when two upcasters match
     * the same type and version.
     *
     * @param upcaster the upcaster
     * @return this builder
     * @throws IllegalArgumentException if the target version is not greater than the source version
     */
    public Builder register(Upcaster upcaster) {
      Objects.requireNonNull(upcaster, "upcaster");
      Objects.requireNonNull(upcaster.eventType(), "upcaster.eventType");
      if (upcaster.sourceVersion() < 1) {
        throw new IllegalArgumentException("sourceVersion must be >= 1, got: " + upcaster.sourceVersion());
      }
      if (upcaster.targetVersion() <= upcaster.sourceVersion()) {
        throw new IllegalArgumentException("targetVersion must be > sourceVersion for "
            + upcaster.eventType() + " v" + upcaster.sourceVersion());
      }
      upcasters.add(upcaster);
      return this;
    }

    public UpcasterChain build() {
      return new UpcasterChain(upcasters);
    }
  }
}
