package io.eventlog.task;

/**
 * A unit of background work started after a command's events are persisted, such as
 * running a query. Implementations should respond to thread interruption, which is how
 * cancellation is delivered.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface DetachedWork<R> {

  /**
   * Runs the work.
   *
   * @return the result
   * @throws Exception on failure
   */
  R execute() throws Exception;
}
