package workqueue.retry;

import workqueue.QueueUnavailableException;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs queue operations with bounded retries on {@link QueueUnavailableException}.
 *
 * <p>Any other exception propagates immediately. When attempts run out the last
 * {@link QueueUnavailableException} is rethrown with earlier failures attached as suppressed.
 */
public final class RetryingExecutor {
  private static final Logger logger = Logger.getLogger(RetryingExecutor.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_BASE_DELAY_MS = 1_000;
  public static final long DEFAULT_MAX_DELAY_MS = 10_000;

  /** Pause between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    Sleeper THREAD = Thread::sleep;
  }

  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Sleeper sleeper;

  /** Three attempts, 1 s base delay, 10 s cap. */
  public RetryingExecutor() {
    this(new ExponentialBackoffRetryPolicy(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS), DEFAULT_MAX_ATTEMPTS);
  }

  public RetryingExecutor(RetryPolicy retryPolicy, int maxAttempts) {
    this(retryPolicy, maxAttempts, Sleeper.THREAD);
  }

  public RetryingExecutor(RetryPolicy retryPolicy, int maxAttempts, Sleeper sleeper) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  /**
   * Executes {@code operation}, retrying while the store is unavailable.
   *
   * @param name      operation name for logging
   * @param operation the work to run
   * @return the operation's result
   * @throws QueueUnavailableException if every attempt failed, or if interrupted while waiting
   */
  public <T> T execute(String name, Supplier<T> operation) {
    Objects.requireNonNull(operation, "operation");
    QueueUnavailableException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return operation.get();
      } catch (QueueUnavailableException e) {
        if (last != null) {
          e.addSuppressed(last);
        }
        last = e;
        if (attempt == maxAttempts) {
          break;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.WARNING, "{0} failed (attempt {1}/{2}), retrying in {3} ms: {4}",
            new Object[]{name, attempt, maxAttempts, delayMs, e.getMessage()});
        try {
          sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
      }
    }
    logger.log(Level.SEVERE, "{0} failed after {1} attempts", new Object[]{name, maxAttempts});
    throw last;
  }

  /** Runnable variant of {@link #execute(String, Supplier)}. */
  public void run(String name, Runnable operation) {
    Objects.requireNonNull(operation, "operation");
    execute(name, () -> {
      operation.run();
      return null;
    });
  }

  public int maxAttempts() {
    return maxAttempts;
  }
}
