package io.eventlog.demo;

import io.eventlog.CommandRejectedException;
import io.eventlog.bus.EventKeys;
import io.eventlog.demo.query.QuerySessionCommand;
import io.eventlog.demo.todo.TodoCommand;
import io.eventlog.feed.FeedConnection;
import io.eventlog.runtime.CommandContext;
import io.eventlog.runtime.CommandResult;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.concurrent.TimeUnit;

/**
 * Runs a short todo session against in-memory H2 and prints the SSE feed.
 *
 * Run with: mvn -pl samples/eventlog-todo-demo exec:java
 */
public final class TodoDemo {

  public static void main(String[] args) throws Exception {
    // 1. Event store and analytics databases
    JdbcDataSource eventStore = new JdbcDataSource();
    eventStore.setURL("jdbc:h2:mem:todo_events;DB_CLOSE_DELAY=-1");
    JdbcDataSource analytics = new JdbcDataSource();
    analytics.setURL("jdbc:h2:mem:todo_analytics;DB_CLOSE_DELAY=-1");
    seedAnalytics(analytics);

    System.out.println("=== Todo Demo ===\n");

    try (TodoApplication app = new TodoApplication(eventStore, analytics)) {
      // 2. Live feed of everything, printed as SSE wire text
      FeedConnection feed = app.feeds().open(null, EventKeys.ALL_EVENTS,
          frame -> System.out.print("[Feed] " + frame.render()));

      // 3. Todo commands
      CommandContext user = CommandContext.user("demo");
      String todoId = UUID.randomUUID().toString();
      CommandResult created = app.gateway().dispatch(
          new TodoCommand.CreateTodo(todoId, "buy milk", Instant.now()), user);
      System.out.println("Created todo " + todoId + " at sequence " + created.globalSequences());

      app.gateway().dispatch(new TodoCommand.UpdateTodoText(todoId, "buy oat milk", Instant.now()), user);
      app.gateway().dispatch(new TodoCommand.CompleteTodo(todoId, Instant.now()), user);
      app.gateway().dispatch(new TodoCommand.DeleteTodo(todoId, Instant.now()), user);
      try {
        app.gateway().dispatch(new TodoCommand.UpdateTodoText(todoId, "too late", Instant.now()), user);
      } catch (CommandRejectedException e) {
        System.out.println("Rejected as expected: " + e.code() + " - " + e.getMessage());
      }

      // 4. A query session runs in the background
      String sessionId = "session-1";
      String queryId = UUID.randomUUID().toString();
      app.gateway().dispatch(new QuerySessionCommand.StartQuery(sessionId, queryId,
          "SELECT * FROM sales WHERE amount > 10", Instant.now()), user);
      waitFor(() -> !app.queryExecution().isRunning(queryId));
      System.out.println("Session state: " + app.sessions().state(sessionId));

      // 5. A failing query opens a follow-up todo through the saga
      app.gateway().dispatch(new QuerySessionCommand.ResetSession(sessionId, Instant.now()), user);
      String badQueryId = UUID.randomUUID().toString();
      app.gateway().dispatch(new QuerySessionCommand.StartQuery(sessionId, badQueryId,
          "SELECT * FROM no_such_table", Instant.now()), user);
      waitFor(() -> app.todos().version("followup-" + badQueryId) > 0);
      System.out.println("Follow-up todo: " + app.todos().state("followup-" + badQueryId));

      TimeUnit.MILLISECONDS.sleep(200);
      feed.close();
      System.out.println("\nFeed closed at sequence " + feed.lastSentSequence());
    }
    System.out.println("=== Demo Complete ===");
  }

  private static void seedAnalytics(JdbcDataSource analytics) throws SQLException {
    try (Connection conn = analytics.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE IF NOT EXISTS sales (id INT PRIMARY KEY, amount INT)");
      stmt.execute("MERGE INTO sales KEY (id) VALUES (1, 5), (2, 25), (3, 40), (4, 12)");
    }
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new IllegalStateException("Timed out waiting for background work");
      }
      TimeUnit.MILLISECONDS.sleep(20);
    }
  }
}
