/**
 * Micrometer bridge for exporting queue broker metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link queues.micrometer.MicrometerMetricsExporter} implements the
 * {@link queues.spi.MetricsExporter} SPI using per-queue Micrometer counters and gauges.
 *
 * @see queues.micrometer.MicrometerMetricsExporter
 */
package queues.micrometer;
