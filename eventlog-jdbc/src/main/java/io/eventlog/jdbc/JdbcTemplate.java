package io.eventlog.jdbc;

import io.eventlog.EventLogStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in event log store implementations.
 *
 * <p>Every {@link SQLException} is wrapped in an {@link EventLogStoreException}, flagged
 * transient when {@link SqlStates#isTransient} says a retry may succeed.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw wrap("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw wrap("Failed to execute query", e);
    }
  }

  /** Execute a single-row, single-column numeric SELECT; SQL NULL maps to {@code null}. */
  public static Long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> {
      long value = rs.getLong(1);
      return rs.wasNull() ? null : value;
    }, params);
    if (values.isEmpty()) {
      throw new EventLogStoreException("Query returned no row: " + sql, null);
    }
    return values.get(0);
  }

  /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw wrap("Failed to execute updateReturning", e);
    }
  }

  /** Execute a parameterless statement such as DDL. */
  public static void execute(Connection conn, String sql) {
    try (Statement st = conn.createStatement()) {
      st.execute(sql);
    } catch (SQLException e) {
      throw wrap("Failed to execute statement", e);
    }
  }

  private static EventLogStoreException wrap(String message, SQLException e) {
    return new EventLogStoreException(message + " (SQLState " + e.getSQLState() + ")", e,
        SqlStates.isTransient(e));
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
