package io.eventlog.demo.query;

import io.eventlog.decider.Decider;
import io.eventlog.decider.Decision;
import io.eventlog.demo.query.QuerySessionCommand.BeginExecution;
import io.eventlog.demo.query.QuerySessionCommand.CancelQuery;
import io.eventlog.demo.query.QuerySessionCommand.CompleteQuery;
import io.eventlog.demo.query.QuerySessionCommand.FailQuery;
import io.eventlog.demo.query.QuerySessionCommand.ResetSession;
import io.eventlog.demo.query.QuerySessionCommand.StartQuery;
import io.eventlog.demo.query.QuerySessionEvent.ExecutionBegan;
import io.eventlog.demo.query.QuerySessionEvent.QueryCancelled;
import io.eventlog.demo.query.QuerySessionEvent.QueryCompleted;
import io.eventlog.demo.query.QuerySessionEvent.QueryFailed;
import io.eventlog.demo.query.QuerySessionEvent.QueryStarted;
import io.eventlog.demo.query.QuerySessionEvent.SessionReset;
import io.eventlog.demo.query.QuerySessionState.Status;

/**
 * Query session lifecycle:
 * {@code IDLE -> PENDING -> EXECUTING -> COMPLETED | FAILED}, with {@code CANCELLED}
 * reachable from {@code PENDING} and {@code EXECUTING}, and {@code ResetSession} returning a
 * terminal session to {@code IDLE}.
 */
public final class QuerySessionDecider implements Decider<QuerySessionCommand, QuerySessionState, QuerySessionEvent> {

  @Override
  public Decision<QuerySessionEvent> decide(QuerySessionCommand command, QuerySessionState state) {
    Status status = state.status();
    if (command instanceof StartQuery start) {
      if (status.isInProgress()) {
        return Decision.reject("query_in_progress", "A query is already running in this session");
      }
      if (status.isTerminal()) {
        return terminal(status);
      }
      if (start.sql() == null || start.sql().isBlank()) {
        return Decision.reject("invalid_sql", "SQL must not be empty");
      }
      return Decision.accept(new QueryStarted(start.sessionId(), start.queryId(), start.sql().strip(),
          start.startedAt()));
    }
    if (command instanceof ResetSession reset) {
      if (status == Status.IDLE) {
        return Decision.noChange();
      }
      if (!status.isTerminal()) {
        return invalidTransition("reset session", status);
      }
      return Decision.accept(new SessionReset(reset.sessionId(), reset.resetAt()));
    }

    String queryId = queryIdOf(command);
    if (status == Status.IDLE) {
      return Decision.reject("no_query_in_progress", "No query is running in this session");
    }
    if (!queryId.equals(state.queryId())) {
      return Decision.reject("query_id_mismatch",
          "Expected query " + state.queryId() + " but got " + queryId);
    }
    if (command instanceof BeginExecution begin) {
      if (status != Status.PENDING) {
        return invalidTransition("begin execution", status);
      }
      return Decision.accept(new ExecutionBegan(begin.sessionId(), queryId, begin.beganAt()));
    }
    if (command instanceof CompleteQuery complete) {
      if (status != Status.EXECUTING) {
        return invalidTransition("complete query", status);
      }
      return Decision.accept(new QueryCompleted(complete.sessionId(), queryId, complete.rowCount(),
          complete.durationMs(), complete.completedAt()));
    }
    if (command instanceof FailQuery fail) {
      if (status != Status.EXECUTING) {
        return invalidTransition("fail query", status);
      }
      return Decision.accept(new QueryFailed(fail.sessionId(), queryId, fail.error(), fail.failedAt()));
    }
    CancelQuery cancel = (CancelQuery) command;
    if (status.isTerminal()) {
      return terminal(status);
    }
    return Decision.accept(new QueryCancelled(cancel.sessionId(), queryId, cancel.reason(), cancel.cancelledAt()));
  }

  @Override
  public QuerySessionState evolve(QuerySessionState state, QuerySessionEvent event) {
    if (event instanceof QueryStarted started) {
      return new QuerySessionState(Status.PENDING, started.queryId(), started.sql(), null, null,
          state.queryCount() + 1);
    }
    if (event instanceof ExecutionBegan) {
      return state.to(Status.EXECUTING);
    }
    if (event instanceof QueryCompleted completed) {
      return new QuerySessionState(Status.COMPLETED, state.queryId(), state.sql(), completed.rowCount(), null,
          state.queryCount());
    }
    if (event instanceof QueryFailed failed) {
      return new QuerySessionState(Status.FAILED, state.queryId(), state.sql(), null, failed.error(),
          state.queryCount());
    }
    if (event instanceof QueryCancelled) {
      return state.to(Status.CANCELLED);
    }
    return new QuerySessionState(Status.IDLE, null, null, null, null, state.queryCount());
  }

  @Override
  public QuerySessionState initialState() {
    return QuerySessionState.IDLE;
  }

  private static String queryIdOf(QuerySessionCommand command) {
    if (command instanceof BeginExecution begin) {
      return begin.queryId();
    }
    if (command instanceof CompleteQuery complete) {
      return complete.queryId();
    }
    if (command instanceof FailQuery fail) {
      return fail.queryId();
    }
    return ((CancelQuery) command).queryId();
  }

  private static Decision<QuerySessionEvent> terminal(Status status) {
    return Decision.reject("terminal_state", "Session is " + status + "; reset it first");
  }

  private static Decision<QuerySessionEvent> invalidTransition(String action, Status status) {
    return Decision.reject("invalid_transition", "Cannot " + action + " while " + status);
  }
}
