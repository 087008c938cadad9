/**
 * Durable, database-backed work queue.
 *
 * <p>Producers {@linkplain workqueue.WorkQueue#enqueue enqueue} JSON payloads into a
 * category. Workers {@linkplain workqueue.WorkQueue#claim claim} batches with skip-locked
 * selection, so concurrent workers never receive the same row, then report each row as
 * {@linkplain workqueue.WorkQueue#complete completed} or
 * {@linkplain workqueue.WorkQueue#fail failed}. Failed rows are retried until
 * {@code maxRetries} is spent. Rows left {@code processing} by a crashed worker are
 * returned to {@code pending} by {@linkplain workqueue.WorkQueue#reclaimOrphans orphan
 * reclamation}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>workqueue-core</b>: API, engine, health, retry and worker loop (no external deps)</li>
 *   <li><b>workqueue-jdbc</b>: H2, MySQL and PostgreSQL stores</li>
 *   <li><b>workqueue-micrometer</b>: metrics bridge</li>
 *   <li><b>workqueue-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * @see workqueue.WorkQueue
 * @see workqueue.WorkQueueConfig
 * @see workqueue.worker.QueueWorker
 */
package workqueue;
