/**
 * JDBC support for the work queue: connection provisioning, statement helpers and
 * table name validation.
 *
 * <p>Dialect stores live in {@link workqueue.jdbc.store}; pick one explicitly or let
 * {@link workqueue.jdbc.store.JdbcQueueStores#detect(javax.sql.DataSource)} choose from
 * the JDBC URL. DDL for each dialect ships under {@code schema/} on the classpath.
 */
package workqueue.jdbc;
