package io.eventlog.demo.todo;

import java.time.Instant;

/**
 * Folded state of one todo item.
 */
public record TodoState(
    String todoId,
    String text,
    Status status,
    Instant createdAt,
    Instant completedAt,
    Instant deletedAt
) {

  public enum Status {
    NOT_CREATED,
    ACTIVE,
    COMPLETED,
    DELETED
  }

  public static final TodoState INITIAL = new TodoState(null, null, Status.NOT_CREATED, null, null, null);

  public boolean exists() {
    return status != Status.NOT_CREATED;
  }

  public boolean isActive() {
    return status == Status.ACTIVE;
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  public boolean isDeleted() {
    return status == Status.DELETED;
  }

  TodoState withText(String newText) {
    return new TodoState(todoId, newText, status, createdAt, completedAt, deletedAt);
  }

  TodoState completed(Instant at) {
    return new TodoState(todoId, text, Status.COMPLETED, createdAt, at, deletedAt);
  }

  TodoState reopened() {
    return new TodoState(todoId, text, Status.ACTIVE, createdAt, null, deletedAt);
  }

  TodoState deleted(Instant at) {
    return new TodoState(todoId, text, Status.DELETED, createdAt, completedAt, at);
  }
}
