package io.eventlog.jdbc;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Classification of {@link SQLException}s by SQLState class.
 */
public final class SqlStates {

  private SqlStates() {}

  /**
   * Whether retrying the failed operation may succeed: transaction rollback (class
   * {@code 40}, serialization failure and deadlock), connection exceptions (class {@code 08})
   * and the driver's own transient or recoverable exception types, lock timeouts included.
   */
  public static boolean isTransient(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current instanceof SQLTransientException || current instanceof SQLRecoverableException) {
        return true;
      }
      String state = current.getSQLState();
      if (state != null && (state.startsWith("40") || state.startsWith("08"))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the failure is an integrity constraint violation (class {@code 23}), the
   * signal of a duplicate {@code (aggregate_type, aggregate_id, aggregate_sequence)} row.
   */
  public static boolean isIntegrityViolation(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
