/**
 * Dialect-specific SQL for the JDBC event log, discovered through {@link java.util.ServiceLoader}.
 */
package io.eventlog.jdbc.store;
