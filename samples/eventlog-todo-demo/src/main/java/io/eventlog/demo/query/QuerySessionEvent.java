package io.eventlog.demo.query;

import java.time.Instant;

public sealed interface QuerySessionEvent {

  String sessionId();

  record QueryStarted(String sessionId, String queryId, String sql, Instant startedAt)
      implements QuerySessionEvent {
  }

  record ExecutionBegan(String sessionId, String queryId, Instant beganAt) implements QuerySessionEvent {
  }

  record QueryCompleted(String sessionId, String queryId, long rowCount, long durationMs, Instant completedAt)
      implements QuerySessionEvent {
  }

  record QueryFailed(String sessionId, String queryId, String error, Instant failedAt)
      implements QuerySessionEvent {
  }

  record QueryCancelled(String sessionId, String queryId, String reason, Instant cancelledAt)
      implements QuerySessionEvent {
  }

  record SessionReset(String sessionId, Instant resetAt) implements QuerySessionEvent {
  }
}
