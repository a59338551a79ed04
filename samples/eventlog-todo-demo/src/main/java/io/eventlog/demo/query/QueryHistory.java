package io.eventlog.demo.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finished queries of every session, oldest first, with per-outcome counts. Queries still
 * running are kept aside until they finish.
 */
public record QueryHistory(
    Map<String, QuerySessionEvent.QueryStarted> running,
    List<Entry> entries,
    int completed,
    int failed,
    int cancelled
) {

  public static final QueryHistory EMPTY = new QueryHistory(Map.of(), List.of(), 0, 0, 0);

  public enum Outcome {
    COMPLETED,
    FAILED,
    CANCELLED
  }

  /**
   * One finished query.
   *
   * @param detail row count for completed queries, the error or cancel reason otherwise
   */
  public record Entry(
      String sessionId,
      String queryId,
      String sql,
      Instant startedAt,
      Outcome outcome,
      String detail,
      Instant finishedAt
  ) {
  }

  public QueryHistory {
    running = Map.copyOf(running);
    entries = List.copyOf(entries);
  }

  public int totalFinished() {
    return completed + failed + cancelled;
  }

  public List<Entry> forSession(String sessionId) {
    List<Entry> result = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.sessionId().equals(sessionId)) {
        result.add(entry);
      }
    }
    return result;
  }

  QueryHistory start(QuerySessionEvent.QueryStarted started) {
    Map<String, QuerySessionEvent.QueryStarted> next = new HashMap<>(running);
    next.put(started.sessionId(), started);
    return new QueryHistory(next, entries, completed, failed, cancelled);
  }

  QueryHistory finish(String sessionId, String queryId, Outcome outcome, String detail, Instant finishedAt) {
    QuerySessionEvent.QueryStarted started = running.get(sessionId);
    if (started == null || !started.queryId().equals(queryId)) {
      return this;
    }
    Map<String, QuerySessionEvent.QueryStarted> nextRunning = new HashMap<>(running);
    nextRunning.remove(sessionId);
    List<Entry> nextEntries = new ArrayList<>(entries);
    nextEntries.add(new Entry(sessionId, queryId, started.sql(), started.startedAt(), outcome, detail, finishedAt));
    return new QueryHistory(nextRunning, nextEntries,
        completed + (outcome == Outcome.COMPLETED ? 1 : 0),
        failed + (outcome == Outcome.FAILED ? 1 : 0),
        cancelled + (outcome == Outcome.CANCELLED ? 1 : 0));
  }
}
