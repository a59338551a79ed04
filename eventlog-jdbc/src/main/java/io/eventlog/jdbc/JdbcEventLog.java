package io.eventlog.jdbc;

import io.eventlog.ConcurrencyConflictException;
import io.eventlog.EventEnvelope;
import io.eventlog.EventLog;
import io.eventlog.EventLogStoreException;
import io.eventlog.StoredEvent;
import io.eventlog.jdbc.store.AbstractJdbcEventLogStore;
import io.eventlog.jdbc.store.JdbcEventLogStores;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.upcast.UpcasterChain;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLog} persisted through JDBC.
 *
 * <p>Each append runs in its own transaction on a connection from the
 * {@link ConnectionProvider}: the global counter row is locked first, then the aggregate's
 * version is checked, then the rows are inserted and the transaction commits. The counter
 * lock orders all committing appenders, which keeps global sequences gapless and in commit
 * order; a rollback gives the reserved sequences back. A duplicate
 * {@code (aggregate_type, aggregate_id, aggregate_sequence)} row is reported as a
 * {@link ConcurrencyConflictException} carrying the re-read actual version.
 *
 * <pre>{@code
 * EventLog log = JdbcEventLog.builder()
 *     .dataSource(dataSource)
 *     .upcasters(upcasters)
 *     .build();
 * }</pre>
 */
public final class JdbcEventLog implements EventLog {
  private static final Logger logger = Logger.getLogger(JdbcEventLog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventLogStore store;
  private final UpcasterChain upcasters;

  private JdbcEventLog(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = builder.store != null ? builder.store : detectStore(connectionProvider);
    this.upcasters = Objects.requireNonNull(builder.upcasters, "upcasters");
  }

  public static Builder builder() {
    return new Builder();
  }

  public AbstractJdbcEventLogStore store() {
    return store;
  }

  /**
   * Creates the event and sequence tables if they do not exist yet.
   */
  public void createSchema() {
    inTransaction(conn -> {
      store.createSchema(conn);
      return null;
    });
  }

  @Override
  public List<Long> append(String aggregateType, String aggregateId, long expectedVersion,
      List<EventEnvelope> events) {
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      long actual = currentVersion(aggregateType, aggregateId);
      if (actual != expectedVersion) {
        throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, actual);
      }
      return List.of();
    }
    try {
      return inTransaction(conn -> insertBatch(conn, aggregateType, aggregateId, expectedVersion, events));
    } catch (EventLogStoreException e) {
      if (e.getCause() instanceof SQLException sql && SqlStates.isIntegrityViolation(sql)) {
        long actual = currentVersion(aggregateType, aggregateId);
        logger.log(Level.FINE, "Duplicate stream position on {0}/{1}, actual version {2}",
            new Object[]{aggregateType, aggregateId, actual});
        ConcurrencyConflictException conflict =
            new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, actual);
        conflict.initCause(e);
        throw conflict;
      }
      throw e;
    }
  }

  private List<Long> insertBatch(Connection conn, String aggregateType, String aggregateId,
      long expectedVersion, List<EventEnvelope> events) {
    long last = store.reserveSequences(conn, events.size());
    long actual = store.currentVersion(conn, aggregateType, aggregateId);
    if (actual != expectedVersion) {
      throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, actual);
    }
    long globalSequence = last - events.size();
    long version = actual;
    List<Long> sequences = new ArrayList<>(events.size());
    for (EventEnvelope envelope : events) {
      StoredEvent row = new StoredEvent(++globalSequence, envelope.eventId(), aggregateType,
          aggregateId, ++version, envelope.eventType(), envelope.schemaVersion(),
          envelope.payload(), envelope.metadata(), envelope.occurredAt());
      store.insert(conn, row);
      sequences.add(globalSequence);
    }
    return sequences;
  }

  @Override
  public List<StoredEvent> load(String aggregateType, String aggregateId) {
    return upcasters.upcastAll(read(conn -> store.load(conn, aggregateType, aggregateId)));
  }

  @Override
  public List<StoredEvent> querySince(long globalSequence, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    return upcasters.upcastAll(read(conn -> store.querySince(conn, globalSequence, limit)));
  }

  @Override
  public long currentVersion(String aggregateType, String aggregateId) {
    return read(conn -> store.currentVersion(conn, aggregateType, aggregateId));
  }

  @Override
  public OptionalLong earliestSequence() {
    return read(store::earliestSequence);
  }

  @Override
  public OptionalLong latestSequence() {
    return read(store::latestSequence);
  }

  @Override
  public int purge() {
    int deleted = inTransaction(store::purge);
    logger.log(Level.WARNING, "Purged {0} events from {1}", new Object[]{deleted, store.tableName()});
    return deleted;
  }

  private <T> T read(Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new EventLogStoreException("Failed to obtain connection", e, SqlStates.isTransient(e));
    }
  }

  private <T> T inTransaction(Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (RuntimeException e) {
        rollback(conn, e);
        throw e;
      } catch (SQLException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new EventLogStoreException("Transaction failed", e, SqlStates.isTransient(e));
    }
  }

  private static void rollback(Connection conn, Exception primary) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  private static AbstractJdbcEventLogStore detectStore(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcEventLogStores.detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event log store", e);
    }
  }

  /**
   * Builder for {@link JdbcEventLog}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventLogStore store;
    private UpcasterChain upcasters = UpcasterChain.EMPTY;

    private Builder() {}

    /**
     * Sets the source of connections. Each append obtains and closes its own connection.
     *
     * <p><b>Required</b> unless {@link #dataSource} is set.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Shortcut for {@code connectionProvider(new DataSourceConnectionProvider(dataSource))}.
     *
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = new DataSourceConnectionProvider(dataSource);
      return this;
    }

    /**
     * Sets the dialect store and its table names.
     *
     * <p>Optional. Defaults to the store registered for the connection's JDBC URL,
     * see {@link JdbcEventLogStores#detect(String)}.
     *
     * @param store the dialect store
     * @return this builder
     */
    public Builder store(AbstractJdbcEventLogStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the upcasters applied on every read.
     *
     * <p>Optional. Defaults to {@link UpcasterChain#EMPTY}.
     *
     * @param upcasters the upcaster chain
     * @return this builder
     */
    public Builder upcasters(UpcasterChain upcasters) {
      this.upcasters = upcasters;
      return this;
    }

    public JdbcEventLog build() {
      return new JdbcEventLog(this);
    }
  }
}
