package io.eventlog.demo.query;

import io.eventlog.decider.Saga;
import io.eventlog.demo.todo.TodoCommand;
import io.eventlog.demo.todo.TodoDecider;

import java.util.List;

/**
 * Opens a todo for every failed query. The todo id is derived from the query id, so a
 * redelivered failure cannot open a second one.
 */
public final class FailedQueryFollowUp implements Saga<QuerySessionEvent, TodoCommand> {
  private static final String PREFIX = "Investigate failed query: ";

  public static String todoIdFor(String queryId) {
    return "followup-" + queryId;
  }

  @Override
  public List<TodoCommand> react(QuerySessionEvent event) {
    if (event instanceof QuerySessionEvent.QueryFailed failed) {
      String text = PREFIX + failed.error();
      if (text.length() > TodoDecider.MAX_TEXT_LENGTH) {
        text = text.substring(0, TodoDecider.MAX_TEXT_LENGTH);
      }
      return List.of(new TodoCommand.CreateTodo(todoIdFor(failed.queryId()), text, failed.failedAt()));
    }
    return List.of();
  }
}
