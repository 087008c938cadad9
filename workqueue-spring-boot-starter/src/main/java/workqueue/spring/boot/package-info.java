/**
 * Spring Boot auto-configuration for the work queue.
 *
 * <p>Binds {@code workqueue.*} properties and wires a {@link workqueue.WorkQueue} from the
 * application {@link javax.sql.DataSource}.
 */
package workqueue.spring.boot;
