package io.eventlog.jdbc.store;

import io.eventlog.EventLogStoreException;
import io.eventlog.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL event log store.
 *
 * <p>Uses {@code UPDATE ... RETURNING} for a single-round-trip counter reservation.
 */
public final class PostgresEventLogStore extends AbstractJdbcEventLogStore {

  public PostgresEventLogStore() {
    super();
  }

  public PostgresEventLogStore(String tableName, String sequenceTableName) {
    super(tableName, sequenceTableName);
  }

  @Override
  public AbstractJdbcEventLogStore withTableNames(String tableName, String sequenceTableName) {
    return new PostgresEventLogStore(tableName, sequenceTableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public long reserveSequences(Connection conn, int count) {
    List<Long> values = JdbcTemplate.updateReturning(conn,
        "UPDATE " + sequenceTableName() + " SET seq_value = seq_value + ? WHERE id = 1 RETURNING seq_value",
        rs -> rs.getLong(1), count);
    if (values.isEmpty()) {
      throw new EventLogStoreException("Sequence row missing in " + sequenceTableName(), null);
    }
    return values.get(0);
  }
}
