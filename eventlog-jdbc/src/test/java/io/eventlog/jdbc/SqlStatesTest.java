package io.eventlog.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatesTest {

  @Test
  void serializationFailureAndDeadlockAreTransient() {
    assertTrue(SqlStates.isTransient(new SQLException("serialization failure", "40001")));
    assertTrue(SqlStates.isTransient(new SQLException("deadlock detected", "40P01")));
  }

  @Test
  void connectionErrorsAreTransient() {
    assertTrue(SqlStates.isTransient(new SQLException("connection refused", "08001")));
    assertTrue(SqlStates.isTransient(new SQLException("connection lost", "08006")));
  }

  @Test
  void lockTimeoutIsTransient() {
    assertTrue(SqlStates.isTransient(new SQLTimeoutException("lock timeout", "HYT00")));
  }

  @Test
  void chainedTransientStateIsDetected() {
    SQLException outer = new SQLException("batch failed", "HY000");
    outer.setNextException(new SQLException("deadlock", "40001"));

    assertTrue(SqlStates.isTransient(outer));
  }

  @Test
  void syntaxAndConstraintErrorsArePermanent() {
    assertFalse(SqlStates.isTransient(new SQLException("syntax error", "42000")));
    assertFalse(SqlStates.isTransient(new SQLException("duplicate key", "23505")));
    assertFalse(SqlStates.isTransient(new SQLException("no state")));
  }

  @Test
  void integrityViolationByStateClass() {
    assertTrue(SqlStates.isIntegrityViolation(new SQLException("duplicate key", "23505")));
    assertTrue(SqlStates.isIntegrityViolation(new SQLIntegrityConstraintViolationException("dup", "23000", 1062)));
    assertFalse(SqlStates.isIntegrityViolation(new SQLException("deadlock", "40001")));
    assertFalse(SqlStates.isIntegrityViolation(new SQLException("no state")));
  }
}
