package io.eventlog.task;

import java.util.concurrent.CompletableFuture;

/**
 * Reference to a spawned detached task.
 */
public interface TaskHandle {

  String correlationId();

  /**
   * Requests cancellation. The task records its cancellation terminal command once.
   *
   * @return {@code true} if the task had not yet reached a terminal status
   */
  boolean cancel();

  /**
   * Completes with the terminal status after the terminal command was dispatched.
   *
   * @return the completion future
   */
  CompletableFuture<TaskStatus> completion();
}
