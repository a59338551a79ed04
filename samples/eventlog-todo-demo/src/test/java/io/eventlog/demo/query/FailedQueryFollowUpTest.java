package io.eventlog.demo.query;

import io.eventlog.demo.todo.TodoCommand;
import io.eventlog.demo.todo.TodoDecider;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailedQueryFollowUpTest {
  private static final Instant T = Instant.parse("2024-05-01T10:00:00Z");

  private final FailedQueryFollowUp saga = new FailedQueryFollowUp();

  @Test
  void failedQueryOpensTodo() {
    List<TodoCommand> commands = saga.react(new QuerySessionEvent.QueryFailed("s-1", "q-1", "table missing", T));
    assertEquals(List.of(new TodoCommand.CreateTodo("followup-q-1",
        "Investigate failed query: table missing", T)), commands);
  }

  @Test
  void otherEventsProduceNothing() {
    assertTrue(saga.react(new QuerySessionEvent.QueryStarted("s-1", "q-1", "SELECT 1", T)).isEmpty());
    assertTrue(saga.react(new QuerySessionEvent.QueryCompleted("s-1", "q-1", 1, 1, T)).isEmpty());
  }

  @Test
  void longErrorsAreTruncated() {
    List<TodoCommand> commands = saga.react(
        new QuerySessionEvent.QueryFailed("s-1", "q-1", "e".repeat(1000), T));
    TodoCommand.CreateTodo create = (TodoCommand.CreateTodo) commands.get(0);
    assertEquals(TodoDecider.MAX_TEXT_LENGTH, create.text().length());
  }
}
