/**
 * JDBC-backed {@link io.eventlog.EventLog}: {@link io.eventlog.jdbc.JdbcEventLog} with
 * dialect stores in {@link io.eventlog.jdbc.store}.
 */
package io.eventlog.jdbc;
