package io.eventlog.demo.todo;

import java.time.Instant;

/**
 * Commands accepted by the Todo aggregate. Timestamps are supplied by the caller.
 */
public sealed interface TodoCommand {

  String todoId();

  record CreateTodo(String todoId, String text, Instant createdAt) implements TodoCommand {
  }

  record UpdateTodoText(String todoId, String text, Instant updatedAt) implements TodoCommand {
  }

  record CompleteTodo(String todoId, Instant completedAt) implements TodoCommand {
  }

  record UncompleteTodo(String todoId, Instant uncompletedAt) implements TodoCommand {
  }

  record DeleteTodo(String todoId, Instant deletedAt) implements TodoCommand {
  }
}
