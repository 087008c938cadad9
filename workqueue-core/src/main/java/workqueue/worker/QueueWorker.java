package workqueue.worker;

import workqueue.FailureOutcome;
import workqueue.QueueUnavailableException;
import workqueue.WorkQueue;
import workqueue.health.HealthReport;
import workqueue.health.HealthStatus;
import workqueue.model.Category;
import workqueue.model.ClaimedItem;
import workqueue.retry.RetryingExecutor;
import workqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claim-process-record loop for one category.
 *
 * <p>Each cycle checks health, claims a batch (retrying while the store is unavailable),
 * hands every item to the {@link WorkHandler}, and records completion or failure per item.
 * A failing item never affects the others in its batch.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class QueueWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());
  private static final int MAX_ERROR_MESSAGE = 1000;

  private final WorkQueue workQueue;
  private final String category;
  private final WorkHandler handler;
  private final int batchSize;
  private final Duration pollInterval;
  private final RetryingExecutor retryingExecutor;
  private final boolean checkHealth;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private QueueWorker(Builder builder) {
    this.workQueue = Objects.requireNonNull(builder.workQueue, "workQueue");
    this.category = Category.validate(builder.category);
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.batchSize = builder.batchSize > 0 ? builder.batchSize : workQueue.config().batchSize();
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be > 0");
    }
    this.retryingExecutor = builder.retryingExecutor != null
        ? builder.retryingExecutor : new RetryingExecutor();
    this.checkHealth = builder.checkHealth;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one claim-process-record cycle.
   *
   * @return counts for this cycle
   * @throws QueueUnavailableException if the instance is unhealthy or the claim keeps failing
   */
  public BatchSummary runOnce() {
    if (checkHealth) {
      HealthReport health = workQueue.healthCheck();
      if (health.status() == HealthStatus.UNHEALTHY) {
        throw new QueueUnavailableException("claim",
            "Instance " + workQueue.instanceId() + " is unhealthy: " + health.stores().values());
      }
    }

    List<ClaimedItem> items = retryingExecutor.execute("claim",
        () -> workQueue.claim(category, batchSize));
    if (items.isEmpty()) {
      return BatchSummary.EMPTY;
    }

    int completed = 0;
    int requeued = 0;
    int failed = 0;
    int conflicts = 0;
    for (ClaimedItem item : items) {
      String result;
      try {
        result = handler.handle(item);
      } catch (Exception e) {
        FailureOutcome outcome = retryingExecutor.execute("fail",
            () -> workQueue.fail(item.id(), errorMessage(e)));
        switch (outcome) {
          case REQUEUED -> requeued++;
          case FAILED -> failed++;
          case NOT_OWNED -> conflicts++;
        }
        continue;
      }
      String resultJson = result;
      boolean recorded = retryingExecutor.execute("complete",
          () -> workQueue.complete(item.id(), resultJson));
      if (recorded) {
        completed++;
      } else {
        conflicts++;
      }
    }

    BatchSummary summary = new BatchSummary(items.size(), completed, requeued, failed, conflicts);
    logger.log(Level.INFO, "Processed batch for {0}: {1}", new Object[]{category, summary});
    return summary;
  }

  /**
   * Starts polling at a fixed delay. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueueWorker has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("workqueue-worker-" + category + "-"));
    pollTask = scheduler.scheduleWithFixedDelay(
        this::runScheduled, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void runScheduled() {
    if (closed) {
      return;
    }
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker cycle failed for category " + category, t);
    }
  }

  /** Stops polling and shuts down the worker thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  static String errorMessage(Throwable t) {
    String message = t.getMessage();
    String text = message == null || message.isBlank()
        ? t.getClass().getName()
        : t.getClass().getSimpleName() + ": " + message;
    return text.length() <= MAX_ERROR_MESSAGE ? text : text.substring(0, MAX_ERROR_MESSAGE);
  }

  /** Builder for {@link QueueWorker}. */
  public static final class Builder {
    private WorkQueue workQueue;
    private String category;
    private WorkHandler handler;
    private int batchSize;
    private Duration pollInterval = Duration.ofSeconds(5);
    private RetryingExecutor retryingExecutor;
    private boolean checkHealth = true;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param workQueue queue to claim from
     * @return this builder
     */
    public Builder workQueue(WorkQueue workQueue) {
      this.workQueue = workQueue;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param category category to claim from
     * @return this builder
     */
    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param handler per-item processing logic
     * @return this builder
     */
    public Builder handler(WorkHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Optional. Defaults to the queue's configured {@code batchSize}.
     *
     * @param batchSize items per claim
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to 5 seconds between cycles.
     *
     * @param pollInterval delay between cycles started by {@link QueueWorker#start()}
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Optional. Defaults to 3 attempts with exponential backoff from 1 s up to 10 s.
     *
     * @param retryingExecutor executor for store calls
     * @return this builder
     */
    public Builder retryingExecutor(RetryingExecutor retryingExecutor) {
      this.retryingExecutor = retryingExecutor;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}: each cycle refuses to claim when the
     * instance is {@link HealthStatus#UNHEALTHY}.
     *
     * @param checkHealth whether to check health before claiming
     * @return this builder
     */
    public Builder checkHealth(boolean checkHealth) {
      this.checkHealth = checkHealth;
      return this;
    }

    public QueueWorker build() {
      return new QueueWorker(this);
    }
  }
}
