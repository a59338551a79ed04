package io.eventlog.demo.query;

import io.eventlog.StoredEvent;
import io.eventlog.demo.query.QuerySessionCommand.BeginExecution;
import io.eventlog.demo.query.QuerySessionCommand.CancelQuery;
import io.eventlog.demo.query.QuerySessionCommand.CompleteQuery;
import io.eventlog.demo.query.QuerySessionCommand.FailQuery;
import io.eventlog.demo.query.QuerySessionEvent.QueryStarted;
import io.eventlog.runtime.CommandContext;
import io.eventlog.runtime.CommittedEventHandler;
import io.eventlog.task.DetachedTaskRegistry;
import io.eventlog.task.TaskOutcome;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a session's SQL after {@code QueryStarted} is committed.
 *
 * <p>Execution is detached from the command that started it: the work runs on the
 * {@link DetachedTaskRegistry} keyed by query id, and its outcome comes back as
 * {@code BeginExecution}, then one of {@code CompleteQuery}, {@code FailQuery} or
 * {@code CancelQuery}.
 */
public final class QueryExecution implements CommittedEventHandler<QuerySessionEvent> {
  private static final Logger logger = Logger.getLogger(QueryExecution.class.getName());

  private final DetachedTaskRegistry tasks;
  private final DataSource analytics;
  private final Clock clock;

  public QueryExecution(DetachedTaskRegistry tasks, DataSource analytics) {
    this(tasks, analytics, Clock.systemUTC());
  }

  public QueryExecution(DetachedTaskRegistry tasks, DataSource analytics, Clock clock) {
    this.tasks = Objects.requireNonNull(tasks, "tasks");
    this.analytics = Objects.requireNonNull(analytics, "analytics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void onCommitted(QuerySessionEvent event, StoredEvent stored, CommandContext context) {
    if (event instanceof QueryStarted started) {
      logger.log(Level.FINE, "Spawning query {0} for session {1}",
          new Object[] {started.queryId(), started.sessionId()});
      tasks.spawn(started.queryId(), () -> countRows(started.sql()), outcome(started));
    }
  }

  /**
   * Requests cancellation of a running query.
   *
   * @param queryId the query id
   * @return {@code true} if the query was still running
   */
  public boolean cancel(String queryId) {
    return tasks.cancel(queryId);
  }

  public boolean isRunning(String queryId) {
    return tasks.isActive(queryId);
  }

  private long countRows(String sql) throws SQLException {
    try (Connection conn = analytics.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      long rows = 0;
      while (rs.next()) {
        if (Thread.currentThread().isInterrupted()) {
          stmt.cancel();
          throw new SQLException("Query interrupted after " + rows + " rows");
        }
        rows++;
      }
      return rows;
    }
  }

  private TaskOutcome<Long> outcome(QueryStarted started) {
    String sessionId = started.sessionId();
    String queryId = started.queryId();
    return new TaskOutcome<>() {
      @Override
      public Object onStarted() {
        return new BeginExecution(sessionId, queryId, clock.instant());
      }

      @Override
      public Object onSuccess(Long rows, Duration elapsed) {
        return new CompleteQuery(sessionId, queryId, rows, elapsed.toMillis(), clock.instant());
      }

      @Override
      public Object onFailure(Exception error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new FailQuery(sessionId, queryId, message, clock.instant());
      }

      @Override
      public Object onCancelled() {
        return new CancelQuery(sessionId, queryId, "cancelled", clock.instant());
      }
    };
  }
}
