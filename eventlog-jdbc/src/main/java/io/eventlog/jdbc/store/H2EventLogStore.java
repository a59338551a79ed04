package io.eventlog.jdbc.store;

import java.util.List;

/**
 * H2 event log store. Primarily for testing.
 *
 * <p>Uses the default UPDATE-then-SELECT counter reservation from
 * {@link AbstractJdbcEventLogStore}.
 */
public final class H2EventLogStore extends AbstractJdbcEventLogStore {

  public H2EventLogStore() {
    super();
  }

  public H2EventLogStore(String tableName, String sequenceTableName) {
    super(tableName, sequenceTableName);
  }

  @Override
  public AbstractJdbcEventLogStore withTableNames(String tableName, String sequenceTableName) {
    return new H2EventLogStore(tableName, sequenceTableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
