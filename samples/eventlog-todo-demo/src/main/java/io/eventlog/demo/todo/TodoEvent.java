package io.eventlog.demo.todo;

import java.time.Instant;

public sealed interface TodoEvent {

  String todoId();

  record TodoCreated(String todoId, String text, Instant createdAt) implements TodoEvent {
  }

  record TodoTextUpdated(String todoId, String text, Instant updatedAt) implements TodoEvent {
  }

  record TodoCompleted(String todoId, Instant completedAt) implements TodoEvent {
  }

  record TodoUncompleted(String todoId, Instant uncompletedAt) implements TodoEvent {
  }

  record TodoDeleted(String todoId, Instant deletedAt) implements TodoEvent {
  }
}
