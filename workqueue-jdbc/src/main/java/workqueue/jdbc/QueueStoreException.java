package workqueue.jdbc;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} raised by JDBC queue stores.
 *
 * <p>{@link workqueue.store.StoreTemplate} turns it into
 * {@link workqueue.QueueUnavailableException} at the queue boundary.
 */
public class QueueStoreException extends RuntimeException {

  public QueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
