package io.eventlog.demo.query;

import io.eventlog.decider.View;
import io.eventlog.demo.query.QuerySessionEvent.QueryCancelled;
import io.eventlog.demo.query.QuerySessionEvent.QueryCompleted;
import io.eventlog.demo.query.QuerySessionEvent.QueryFailed;
import io.eventlog.demo.query.QuerySessionEvent.QueryStarted;

/**
 * Projects query session events of all sessions into a {@link QueryHistory}. A session reset
 * drops nothing from the history; it only clears the session's current query.
 */
public final class QueryHistoryView implements View<QueryHistory, QuerySessionEvent> {

  @Override
  public QueryHistory evolve(QueryHistory state, QuerySessionEvent event) {
    if (event instanceof QueryStarted started) {
      return state.start(started);
    }
    if (event instanceof QueryCompleted completed) {
      return state.finish(completed.sessionId(), completed.queryId(), QueryHistory.Outcome.COMPLETED,
          completed.rowCount() + " rows", completed.completedAt());
    }
    if (event instanceof QueryFailed failed) {
      return state.finish(failed.sessionId(), failed.queryId(), QueryHistory.Outcome.FAILED,
          failed.error(), failed.failedAt());
    }
    if (event instanceof QueryCancelled cancelled) {
      return state.finish(cancelled.sessionId(), cancelled.queryId(), QueryHistory.Outcome.CANCELLED,
          cancelled.reason(), cancelled.cancelledAt());
    }
    // ExecutionBegan and SessionReset leave the history unchanged
    return state;
  }

  @Override
  public QueryHistory initialState() {
    return QueryHistory.EMPTY;
  }
}
