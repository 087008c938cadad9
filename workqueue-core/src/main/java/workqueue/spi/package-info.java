/**
 * Service Provider Interfaces (SPI) for extending the work queue.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in connection provisioning, persistence, health probes, and metrics.
 *
 * @see workqueue.spi.ConnectionProvider
 * @see workqueue.spi.QueueStore
 * @see workqueue.spi.BackingStoreCheck
 * @see workqueue.spi.MetricsExporter
 */
package workqueue.spi;
