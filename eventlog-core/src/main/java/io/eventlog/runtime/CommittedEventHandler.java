package io.eventlog.runtime;

import io.eventlog.StoredEvent;

/**
 * Post-commit side effect of an aggregate runtime, such as starting background work.
 *
 * <p>Invoked once per appended event, after the batch is durable and published. Failures are
 * logged and never undo or fail the command.
 *
 * @param <E> the domain event type
 */
@FunctionalInterface
public interface CommittedEventHandler<E> {

  /**
   * Reacts to a committed event.
   *
   * @param event   the decoded domain event
   * @param stored  the persisted record
   * @param context the context of the command that produced it
   * @throws Exception on failure; logged by the runtime
   */
  void onCommitted(E event, StoredEvent stored, CommandContext context) throws Exception;
}
