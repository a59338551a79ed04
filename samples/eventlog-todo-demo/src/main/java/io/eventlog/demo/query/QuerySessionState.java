package io.eventlog.demo.query;

/**
 * Folded state of a query session. A session runs one query at a time and must be reset
 * after it reaches a terminal status.
 */
public record QuerySessionState(
    Status status,
    String queryId,
    String sql,
    Long rowCount,
    String error,
    int queryCount
) {

  public enum Status {
    IDLE,
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
      return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isInProgress() {
      return this == PENDING || this == EXECUTING;
    }
  }

  public static final QuerySessionState IDLE = new QuerySessionState(Status.IDLE, null, null, null, null, 0);

  QuerySessionState to(Status next) {
    return new QuerySessionState(next, queryId, sql, rowCount, error, queryCount);
  }
}
