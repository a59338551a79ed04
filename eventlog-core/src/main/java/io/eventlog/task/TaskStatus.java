package io.eventlog.task;

/**
 * Terminal status of a detached task.
 */
public enum TaskStatus {
  COMPLETED,
  FAILED,
  CANCELLED
}
