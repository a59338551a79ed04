/**
 * Spring Boot auto-configuration for the event log, bound from {@code eventlog.*} properties.
 *
 * @see io.eventlog.spring.boot.EventLogAutoConfiguration
 */
package io.eventlog.spring.boot;
