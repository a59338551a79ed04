package io.eventlog.runtime;

import io.eventlog.StoredEvent;

import java.util.List;

/**
 * Outcome of a successfully handled command.
 *
 * @param correlationId   the request's correlation id
 * @param aggregateId     the target aggregate
 * @param version         aggregate version after the command
 * @param globalSequences global sequences of the appended events, empty for a no-op
 * @param events          the appended events
 */
public record CommandResult(
    String correlationId,
    String aggregateId,
    long version,
    List<Long> globalSequences,
    List<StoredEvent> events
) {

  public CommandResult {
    globalSequences = List.copyOf(globalSequences);
    events = List.copyOf(events);
  }

  static CommandResult unchanged(String correlationId, String aggregateId, long version) {
    return new CommandResult(correlationId, aggregateId, version, List.of(), List.of());
  }

  /**
   * Returns whether the command appended at least one event.
   *
   * @return {@code false} for an accepted no-op
   */
  public boolean changed() {
    return !events.isEmpty();
  }
}
