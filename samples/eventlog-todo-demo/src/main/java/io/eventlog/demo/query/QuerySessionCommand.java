package io.eventlog.demo.query;

import java.time.Instant;

/**
 * Commands accepted by a query session. {@code StartQuery} comes from a user, the rest are
 * issued by the background execution or by a cancel/reset request.
 */
public sealed interface QuerySessionCommand {

  String sessionId();

  record StartQuery(String sessionId, String queryId, String sql, Instant startedAt)
      implements QuerySessionCommand {
  }

  record BeginExecution(String sessionId, String queryId, Instant beganAt) implements QuerySessionCommand {
  }

  record CompleteQuery(String sessionId, String queryId, long rowCount, long durationMs, Instant completedAt)
      implements QuerySessionCommand {
  }

  record FailQuery(String sessionId, String queryId, String error, Instant failedAt)
      implements QuerySessionCommand {
  }

  record CancelQuery(String sessionId, String queryId, String reason, Instant cancelledAt)
      implements QuerySessionCommand {
  }

  record ResetSession(String sessionId, Instant resetAt) implements QuerySessionCommand {
  }
}
