package io.eventlog.jdbc.store;

import io.eventlog.EventLogStoreException;
import io.eventlog.StoredEvent;
import io.eventlog.jdbc.JdbcTemplate;
import io.eventlog.jdbc.TableNames;
import io.eventlog.util.JsonCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Matcher;

/**
 * Base JDBC event log store with standard SQL implementations.
 *
 * <p>All methods run on a caller-supplied connection and never commit; transaction
 * boundaries belong to {@link io.eventlog.jdbc.JdbcEventLog}. Global sequences come from a
 * single-row counter table whose row lock is taken by {@link #reserveSequences} and held
 * until the appending transaction ends, so sequences are handed out in commit order.
 *
 * <p>Subclasses override {@link #reserveSequences} to provide database-specific counter
 * increments. Register custom implementations via
 * {@code META-INF/services/io.eventlog.jdbc.store.AbstractJdbcEventLogStore}.
 *
 * @see JdbcEventLogStores
 */
public abstract class AbstractJdbcEventLogStore {
  private static final String COLUMNS = "global_sequence, event_id, aggregate_type, aggregate_id, "
      + "aggregate_sequence, event_type, schema_version, payload, metadata, created_at";

  private final String tableName;
  private final String sequenceTableName;
  private final JsonCodec jsonCodec = JsonCodec.getDefault();
  private final JdbcTemplate.RowMapper<StoredEvent> rowMapper = rs -> new StoredEvent(
      rs.getLong("global_sequence"),
      rs.getString("event_id"),
      rs.getString("aggregate_type"),
      rs.getString("aggregate_id"),
      rs.getLong("aggregate_sequence"),
      rs.getString("event_type"),
      rs.getInt("schema_version"),
      rs.getBytes("payload"),
      jsonCodec.parseObject(rs.getString("metadata")),
      rs.getTimestamp("created_at").toInstant());

  protected AbstractJdbcEventLogStore() {
    this(TableNames.DEFAULT_TABLE, TableNames.DEFAULT_SEQUENCE_TABLE);
  }

  protected AbstractJdbcEventLogStore(String tableName, String sequenceTableName) {
    this.tableName = TableNames.validate(tableName);
    this.sequenceTableName = TableNames.validate(sequenceTableName);
    if (tableName.equalsIgnoreCase(sequenceTableName)) {
      throw new IllegalArgumentException("Event table and sequence table must differ: " + tableName);
    }
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect writing to the given tables.
   */
  public abstract AbstractJdbcEventLogStore withTableNames(String tableName, String sequenceTableName);

  public String tableName() {
    return tableName;
  }

  public String sequenceTableName() {
    return sequenceTableName;
  }

  /** Classpath location of this dialect's DDL. */
  public String schemaResource() {
    return "/io/eventlog/jdbc/schema/" + name() + ".sql";
  }

  /**
   * Creates the event table and the sequence table if they are missing, rewriting the
   * default table names to this store's names. Safe to run more than once.
   */
  public void createSchema(Connection conn) {
    String ddl = loadSchema()
        .replaceAll("\\b" + TableNames.DEFAULT_SEQUENCE_TABLE + "\\b",
            Matcher.quoteReplacement(sequenceTableName))
        .replaceAll("\\b" + TableNames.DEFAULT_TABLE + "\\b", Matcher.quoteReplacement(tableName));
    for (String statement : ddl.split(";")) {
      String trimmed = statement.trim();
      if (!trimmed.isEmpty()) {
        JdbcTemplate.execute(conn, trimmed);
      }
    }
  }

  /**
   * Advances the global counter by {@code count} and returns its new value, taking the
   * counter row lock for the rest of the transaction. The reserved sequences are
   * {@code result - count + 1 .. result}.
   */
  public long reserveSequences(Connection conn, int count) {
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + sequenceTableName + " SET seq_value = seq_value + ? WHERE id = 1", count);
    if (updated != 1) {
      throw new EventLogStoreException("Sequence row missing in " + sequenceTableName, null);
    }
    return JdbcTemplate.queryForLong(conn,
        "SELECT seq_value FROM " + sequenceTableName + " WHERE id = 1");
  }

  public long currentVersion(Connection conn, String aggregateType, String aggregateId) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT COALESCE(MAX(aggregate_sequence), 0) FROM " + tableName
            + " WHERE aggregate_type=? AND aggregate_id=?",
        aggregateType, aggregateId);
  }

  public void insert(Connection conn, StoredEvent event) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.globalSequence(), event.eventId(), event.aggregateType(), event.aggregateId(),
        event.aggregateSequence(), event.eventType(), event.schemaVersion(), event.payload(),
        jsonCodec.toJson(event.metadata()), Timestamp.from(event.createdAt()));
  }

  public List<StoredEvent> load(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE aggregate_type=? AND aggregate_id=? ORDER BY aggregate_sequence";
    return JdbcTemplate.query(conn, sql, rowMapper, aggregateType, aggregateId);
  }

  public List<StoredEvent> querySince(Connection conn, long globalSequence, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE global_sequence > ? ORDER BY global_sequence LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, globalSequence, limit);
  }

  public OptionalLong earliestSequence(Connection conn) {
    return optional(JdbcTemplate.queryForLong(conn, "SELECT MIN(global_sequence) FROM " + tableName));
  }

  public OptionalLong latestSequence(Connection conn) {
    return optional(JdbcTemplate.queryForLong(conn, "SELECT MAX(global_sequence) FROM " + tableName));
  }

  /**
   * Deletes every event and resets the counter. Locks the counter first so no append
   * interleaves.
   */
  public int purge(Connection conn) {
    JdbcTemplate.update(conn, "UPDATE " + sequenceTableName + " SET seq_value = 0 WHERE id = 1");
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName);
  }

  private static OptionalLong optional(Long value) {
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  private String loadSchema() {
    try (InputStream in = AbstractJdbcEventLogStore.class.getResourceAsStream(schemaResource())) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + schemaResource());
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read schema resource " + schemaResource(), e);
    }
  }
}
