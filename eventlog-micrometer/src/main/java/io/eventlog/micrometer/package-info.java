/**
 * Micrometer bridge for exporting event log metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.eventlog.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.eventlog.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see io.eventlog.micrometer.MicrometerMetricsExporter
 */
package io.eventlog.micrometer;
