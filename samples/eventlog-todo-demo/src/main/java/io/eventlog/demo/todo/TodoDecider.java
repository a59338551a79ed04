package io.eventlog.demo.todo;

import io.eventlog.decider.Decider;
import io.eventlog.decider.Decision;
import io.eventlog.demo.todo.TodoCommand.CompleteTodo;
import io.eventlog.demo.todo.TodoCommand.CreateTodo;
import io.eventlog.demo.todo.TodoCommand.DeleteTodo;
import io.eventlog.demo.todo.TodoCommand.UncompleteTodo;
import io.eventlog.demo.todo.TodoCommand.UpdateTodoText;
import io.eventlog.demo.todo.TodoEvent.TodoCompleted;
import io.eventlog.demo.todo.TodoEvent.TodoCreated;
import io.eventlog.demo.todo.TodoEvent.TodoDeleted;
import io.eventlog.demo.todo.TodoEvent.TodoTextUpdated;
import io.eventlog.demo.todo.TodoEvent.TodoUncompleted;

/**
 * Todo lifecycle: {@code NOT_CREATED -> ACTIVE <-> COMPLETED -> DELETED}.
 *
 * <p>Invalid commands are rejected outright. Completing a completed item, reopening an active
 * one and deleting a deleted one are accepted without events.
 */
public final class TodoDecider implements Decider<TodoCommand, TodoState, TodoEvent> {
  public static final int MAX_TEXT_LENGTH = 500;

  @Override
  public Decision<TodoEvent> decide(TodoCommand command, TodoState state) {
    if (command instanceof CreateTodo create) {
      if (state.exists()) {
        return Decision.reject("already_exists", "Todo " + create.todoId() + " already exists");
      }
      String text = validText(create.text());
      if (text == null) {
        return invalidText();
      }
      return Decision.accept(new TodoCreated(create.todoId(), text, create.createdAt()));
    }
    if (command instanceof UpdateTodoText update) {
      if (!state.exists() || state.isDeleted()) {
        return notFound(update.todoId());
      }
      String text = validText(update.text());
      if (text == null) {
        return invalidText();
      }
      if (text.equals(state.text())) {
        return Decision.noChange();
      }
      return Decision.accept(new TodoTextUpdated(update.todoId(), text, update.updatedAt()));
    }
    if (command instanceof CompleteTodo complete) {
      if (state.isCompleted()) {
        return Decision.noChange();
      }
      if (!state.isActive()) {
        return Decision.reject("cannot_complete", "Only an active todo can be completed");
      }
      return Decision.accept(new TodoCompleted(complete.todoId(), complete.completedAt()));
    }
    if (command instanceof UncompleteTodo uncomplete) {
      if (state.isActive()) {
        return Decision.noChange();
      }
      if (!state.isCompleted()) {
        return Decision.reject("cannot_uncomplete", "Only a completed todo can be reopened");
      }
      return Decision.accept(new TodoUncompleted(uncomplete.todoId(), uncomplete.uncompletedAt()));
    }
    DeleteTodo delete = (DeleteTodo) command;
    if (state.isDeleted()) {
      return Decision.noChange();
    }
    if (!state.exists()) {
      return Decision.reject("cannot_delete", "Todo " + delete.todoId() + " does not exist");
    }
    return Decision.accept(new TodoDeleted(delete.todoId(), delete.deletedAt()));
  }

  @Override
  public TodoState evolve(TodoState state, TodoEvent event) {
    if (event instanceof TodoCreated created) {
      return new TodoState(created.todoId(), created.text(), TodoState.Status.ACTIVE,
          created.createdAt(), null, null);
    }
    if (event instanceof TodoTextUpdated updated) {
      return state.withText(updated.text());
    }
    if (event instanceof TodoCompleted completed) {
      return state.completed(completed.completedAt());
    }
    if (event instanceof TodoUncompleted) {
      return state.reopened();
    }
    return state.deleted(((TodoDeleted) event).deletedAt());
  }

  @Override
  public TodoState initialState() {
    return TodoState.INITIAL;
  }

  /** Trimmed text, or {@code null} when blank or too long. */
  private static String validText(String text) {
    if (text == null) {
      return null;
    }
    String trimmed = text.strip();
    if (trimmed.isEmpty() || trimmed.length() > MAX_TEXT_LENGTH) {
      return null;
    }
    return trimmed;
  }

  private static Decision<TodoEvent> invalidText() {
    return Decision.reject("invalid_text", "Text must be 1 to " + MAX_TEXT_LENGTH + " characters");
  }

  private static Decision<TodoEvent> notFound(String todoId) {
    return Decision.reject("not_found", "Todo " + todoId + " not found");
  }
}
