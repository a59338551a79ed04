package io.eventlog.jdbc.store;

import java.util.List;

/**
 * MySQL/TiDB event log store.
 *
 * <p>The counter UPDATE is the first statement of the append transaction, so InnoDB's read
 * view for the version check is only created once the counter row lock is held.
 */
public final class MySqlEventLogStore extends AbstractJdbcEventLogStore {

  public MySqlEventLogStore() {
    super();
  }

  public MySqlEventLogStore(String tableName, String sequenceTableName) {
    super(tableName, sequenceTableName);
  }

  @Override
  public AbstractJdbcEventLogStore withTableNames(String tableName, String sequenceTableName) {
    return new MySqlEventLogStore(tableName, sequenceTableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }
}
