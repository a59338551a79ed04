package io.eventlog.task;

import java.time.Duration;

/**
 * Maps the lifecycle of a detached task to the commands that record it.
 *
 * <p>Every method returns a command for the {@link io.eventlog.runtime.CommandGateway}, or
 * {@code null} to record nothing. Exactly one of {@link #onSuccess}, {@link #onFailure} and
 * {@link #onCancelled} is used per task.
 *
 * @param <R> result type of the work
 */
public interface TaskOutcome<R> {

  /**
   * Command recorded when the work starts running.
   *
   * @return a command, or {@code null}
   */
  default Object onStarted() {
    return null;
  }

  Object onSuccess(R result, Duration elapsed);

  Object onFailure(Exception error);

  Object onCancelled();
}
