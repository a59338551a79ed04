package io.eventlog.demo.query;

import io.eventlog.jackson.JacksonEventCodec;
import io.eventlog.runtime.AggregateDefinition;
import io.eventlog.runtime.ConflictPolicy;

/**
 * Wiring for the QuerySession aggregate. Commands issued by background execution retry on
 * conflict; user commands fail fast.
 */
public final class QuerySessionAggregate {
  public static final String TYPE = "QuerySession";

  public static final JacksonEventCodec<QuerySessionEvent> CODEC = JacksonEventCodec.builder(QuerySessionEvent.class)
      .register("QueryStarted", QuerySessionEvent.QueryStarted.class)
      .register("ExecutionBegan", QuerySessionEvent.ExecutionBegan.class)
      .register("QueryCompleted", QuerySessionEvent.QueryCompleted.class)
      .register("QueryFailed", QuerySessionEvent.QueryFailed.class)
      .register("QueryCancelled", QuerySessionEvent.QueryCancelled.class)
      .register("SessionReset", QuerySessionEvent.SessionReset.class)
      .build();

  private QuerySessionAggregate() {
  }

  public static AggregateDefinition<QuerySessionCommand, QuerySessionState, QuerySessionEvent> definition() {
    return AggregateDefinition.<QuerySessionCommand, QuerySessionState, QuerySessionEvent>builder(
            QuerySessionCommand.class, TYPE)
        .decider(new QuerySessionDecider())
        .codec(CODEC)
        .aggregateId(QuerySessionCommand::sessionId)
        .conflictPolicy(QuerySessionCommand.BeginExecution.class, ConflictPolicy.RETRY)
        .conflictPolicy(QuerySessionCommand.CompleteQuery.class, ConflictPolicy.RETRY)
        .conflictPolicy(QuerySessionCommand.FailQuery.class, ConflictPolicy.RETRY)
        .conflictPolicy(QuerySessionCommand.CancelQuery.class, ConflictPolicy.RETRY)
        .build();
  }
}
