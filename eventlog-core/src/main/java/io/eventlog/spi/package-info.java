/**
 * Service provider interfaces for pluggable infrastructure: JDBC connections and metrics export.
 */
package io.eventlog.spi;
