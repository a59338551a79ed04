package io.eventlog.demo.query;

import io.eventlog.demo.query.QuerySessionEvent.ExecutionBegan;
import io.eventlog.demo.query.QuerySessionEvent.QueryCancelled;
import io.eventlog.demo.query.QuerySessionEvent.QueryCompleted;
import io.eventlog.demo.query.QuerySessionEvent.QueryFailed;
import io.eventlog.demo.query.QuerySessionEvent.QueryStarted;
import io.eventlog.demo.query.QuerySessionEvent.SessionReset;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryHistoryViewTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T1 = Instant.parse("2024-05-01T10:00:05Z");

  private final QueryHistoryView view = new QueryHistoryView();

  @Test
  void startsEmpty() {
    QueryHistory history = view.initialState();
    assertTrue(history.entries().isEmpty());
    assertEquals(0, history.totalFinished());
  }

  @Test
  void recordsEachOutcomeWithItsStart() {
    QueryHistory history = view.fold(List.of(
        new QueryStarted("s-1", "q-1", "SELECT 1", T0),
        new ExecutionBegan("s-1", "q-1", T0),
        new QueryCompleted("s-1", "q-1", 3, 12, T1),
        new SessionReset("s-1", T1),
        new QueryStarted("s-1", "q-2", "SELECT x", T0),
        new QueryFailed("s-1", "q-2", "column not found", T1),
        new SessionReset("s-1", T1),
        new QueryStarted("s-1", "q-3", "SELECT 2", T0),
        new QueryCancelled("s-1", "q-3", "user", T1)));

    assertEquals(1, history.completed());
    assertEquals(1, history.failed());
    assertEquals(1, history.cancelled());
    assertEquals(3, history.totalFinished());
    assertTrue(history.running().isEmpty());

    QueryHistory.Entry first = history.entries().get(0);
    assertEquals("q-1", first.queryId());
    assertEquals("SELECT 1", first.sql());
    assertEquals(T0, first.startedAt());
    assertEquals(T1, first.finishedAt());
    assertEquals(QueryHistory.Outcome.COMPLETED, first.outcome());
    assertEquals("3 rows", first.detail());
    assertEquals("column not found", history.entries().get(1).detail());
    assertEquals(QueryHistory.Outcome.CANCELLED, history.entries().get(2).outcome());
  }

  @Test
  void runningQueryIsNotInTheHistory() {
    QueryHistory history = view.fold(List.of(
        new QueryStarted("s-1", "q-1", "SELECT 1", T0),
        new ExecutionBegan("s-1", "q-1", T0)));

    assertTrue(history.entries().isEmpty());
    assertEquals("q-1", history.running().get("s-1").queryId());
  }

  @Test
  void keepsSessionsApart() {
    QueryHistory history = view.fold(List.of(
        new QueryStarted("s-1", "q-1", "SELECT 1", T0),
        new QueryStarted("s-2", "q-2", "SELECT 2", T0),
        new QueryFailed("s-2", "q-2", "boom", T1),
        new QueryCompleted("s-1", "q-1", 1, 5, T1)));

    assertEquals(List.of("q-1"), history.forSession("s-1").stream().map(QueryHistory.Entry::queryId).toList());
    assertEquals(List.of("q-2"), history.forSession("s-2").stream().map(QueryHistory.Entry::queryId).toList());
    assertEquals(List.of("q-2", "q-1"), history.entries().stream().map(QueryHistory.Entry::queryId).toList());
  }

  @Test
  void outcomeOfUnknownQueryIsIgnored() {
    QueryHistory history = view.fold(List.of(
        new QueryStarted("s-1", "q-1", "SELECT 1", T0),
        new QueryCompleted("s-1", "q-other", 1, 5, T1)));

    assertEquals(0, history.totalFinished());
    assertEquals(1, history.running().size());
  }
}
