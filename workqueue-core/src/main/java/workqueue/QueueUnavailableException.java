package workqueue;

/**
 * Thrown when the backing store cannot complete an operation: connection failure,
 * statement error, timeout or resource exhaustion. Store-native exception types
 * are kept as the cause only.
 *
 * <p>Treat as transient; see {@link workqueue.retry.RetryingExecutor}.
 */
public final class QueueUnavailableException extends WorkQueueException {
  private final String operation;

  public QueueUnavailableException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  public QueueUnavailableException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  /** The queue operation that failed (e.g. {@code claim}, {@code complete}). */
  public String operation() {
    return operation;
  }
}
