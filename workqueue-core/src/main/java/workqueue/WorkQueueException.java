package workqueue;

/**
 * Base type of every error the work queue raises on purpose.
 *
 * <p>The hierarchy is closed: callers can switch over the three permitted kinds and
 * apply one policy per kind.
 * <ul>
 *   <li>{@link ConfigurationException}: invalid settings, raised at construction; not retryable.</li>
 *   <li>{@link QueueUnavailableException}: the backing store failed; transient, retry with backoff.</li>
 *   <li>{@link OwnershipConflictException}: the row is no longer owned by this instance.</li>
 * </ul>
 */
public abstract sealed class WorkQueueException extends RuntimeException
    permits ConfigurationException, QueueUnavailableException, OwnershipConflictException {

  protected WorkQueueException(String message) {
    super(message);
  }

  protected WorkQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
