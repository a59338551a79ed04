package io.eventlog.demo;

import io.eventlog.EventLog;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.EventKeys;
import io.eventlog.bus.SubscriptionOptions;
import io.eventlog.demo.query.FailedQueryFollowUp;
import io.eventlog.demo.query.QueryHistory;
import io.eventlog.demo.query.QueryHistoryView;
import io.eventlog.demo.query.QueryExecution;
import io.eventlog.demo.query.QuerySessionAggregate;
import io.eventlog.demo.query.QuerySessionCommand;
import io.eventlog.demo.query.QuerySessionEvent;
import io.eventlog.demo.query.QuerySessionState;
import io.eventlog.demo.todo.TodoAggregate;
import io.eventlog.demo.todo.TodoCommand;
import io.eventlog.demo.todo.TodoEvent;
import io.eventlog.demo.todo.TodoState;
import io.eventlog.feed.ReplayCoordinator;
import io.eventlog.jdbc.JdbcEventLog;
import io.eventlog.runtime.AggregateRuntime;
import io.eventlog.runtime.CommandGateway;
import io.eventlog.task.DetachedTaskRegistry;
import io.eventlog.upcast.UpcasterChain;
import io.eventlog.view.Projection;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Wires the Todo and QuerySession aggregates over a JDBC event log.
 *
 * <p>{@code eventStore} holds the event log tables; {@code analytics} is the database the
 * query sessions run their SQL against.
 */
public final class TodoApplication implements AutoCloseable {
  private final JdbcEventLog eventLog;
  private final EventBus bus;
  private final CommandGateway gateway;
  private final DetachedTaskRegistry tasks;
  private final QueryExecution queryExecution;
  private final AggregateRuntime<TodoCommand, TodoState, TodoEvent> todos;
  private final AggregateRuntime<QuerySessionCommand, QuerySessionState, QuerySessionEvent> sessions;
  private final ReadModelCache todoCache;
  private final Projection<QueryHistory, QuerySessionEvent> queryHistory;
  private final ReplayCoordinator feeds;

  public TodoApplication(DataSource eventStore, DataSource analytics) {
    this(eventStore, analytics, ReplayCoordinator.DEFAULT_KEEP_ALIVE);
  }

  public TodoApplication(DataSource eventStore, DataSource analytics, Duration keepAlive) {
    this.eventLog = JdbcEventLog.builder()
        .dataSource(eventStore)
        .upcasters(UpcasterChain.builder().register(TodoAggregate.CREATED_V1_UPCASTER).build())
        .build();
    eventLog.createSchema();

    this.bus = new EventBus();
    this.gateway = new CommandGateway();
    this.tasks = new DetachedTaskRegistry(gateway, 2);
    this.queryExecution = new QueryExecution(tasks, analytics);

    this.todos = AggregateRuntime.builder(TodoAggregate.definition())
        .eventLog(eventLog)
        .eventBus(bus)
        .build();
    this.sessions = AggregateRuntime.builder(QuerySessionAggregate.definition())
        .eventLog(eventLog)
        .eventBus(bus)
        .onCommitted(queryExecution)
        .saga(new FailedQueryFollowUp())
        .gateway(gateway)
        .build();
    gateway.register(todos).register(sessions);

    this.todoCache = new ReadModelCache(todos::state);
    bus.subscribe(EventKeys.aggregateTypePattern(TodoAggregate.TYPE), SubscriptionOptions.defaults(), todoCache);

    this.queryHistory = Projection.builder(new QueryHistoryView(), QuerySessionAggregate.CODEC)
        .eventLog(eventLog)
        .filter(EventKeys.aggregateTypePattern(QuerySessionAggregate.TYPE))
        .build();
    queryHistory.subscribe(bus, SubscriptionOptions.defaults());

    this.feeds = ReplayCoordinator.builder()
        .eventLog(eventLog)
        .eventBus(bus)
        .keepAlive(keepAlive)
        .build();
  }

  public EventLog eventLog() {
    return eventLog;
  }

  public EventBus bus() {
    return bus;
  }

  public CommandGateway gateway() {
    return gateway;
  }

  public AggregateRuntime<TodoCommand, TodoState, TodoEvent> todos() {
    return todos;
  }

  public AggregateRuntime<QuerySessionCommand, QuerySessionState, QuerySessionEvent> sessions() {
    return sessions;
  }

  public QueryExecution queryExecution() {
    return queryExecution;
  }

  public ReadModelCache todoCache() {
    return todoCache;
  }

  public Projection<QueryHistory, QuerySessionEvent> queryHistory() {
    return queryHistory;
  }

  public ReplayCoordinator feeds() {
    return feeds;
  }

  @Override
  public void close() {
    feeds.close();
    tasks.close();
    sessions.close();
    todos.close();
    bus.close();
  }
}
