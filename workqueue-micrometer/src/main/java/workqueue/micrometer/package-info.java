/**
 * Micrometer bridge for exporting queue metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link workqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link workqueue.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package workqueue.micrometer;
