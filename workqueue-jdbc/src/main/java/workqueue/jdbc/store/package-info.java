/**
 * Dialect-specific JDBC queue stores.
 *
 * <p>{@link workqueue.jdbc.store.PostgresQueueStore} and {@link workqueue.jdbc.store.MySqlQueueStore}
 * claim with {@code FOR UPDATE SKIP LOCKED}; {@link workqueue.jdbc.store.H2QueueStore} relies on
 * per-row conditional updates. Use {@link workqueue.jdbc.store.JdbcQueueStores} to pick one from a
 * JDBC URL.
 */
package workqueue.jdbc.store;
