package workqueue.reclaim;

import workqueue.WorkQueue;
import workqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that periodically reclaims orphaned rows through
 * {@link WorkQueue#reclaimOrphans(Duration)}.
 *
 * <p>Builder pattern, {@link AutoCloseable}, daemon thread, synchronized lifecycle.
 * A failed cycle is logged and the schedule keeps running.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see OrphanReclaimScheduler.Builder
 */
public final class OrphanReclaimScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OrphanReclaimScheduler.class.getName());

  private final WorkQueue workQueue;
  private final Duration timeout;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reclaimTask;
  private volatile boolean closed;

  private OrphanReclaimScheduler(Builder builder) {
    this.workQueue = Objects.requireNonNull(builder.workQueue, "workQueue");
    if (builder.timeout != null && builder.timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.timeout = builder.timeout != null ? builder.timeout : workQueue.config().cleanupTimeout();
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled reclaim loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OrphanReclaimScheduler has been closed");
    }
    if (reclaimTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("workqueue-reclaim-"));
    reclaimTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single reclaim cycle.
   *
   * <p>May be invoked directly for testing or one-off recovery.
   *
   * @return rows reclaimed, or 0 if closed or the cycle failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      return workQueue.reclaimOrphans(timeout);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Orphan reclaim cycle failed", t);
      return 0;
    }
  }

  /** Cancels the reclaim schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reclaimTask != null) {
      reclaimTask.cancel(false);
      reclaimTask = null;
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

  /** Builder for {@link OrphanReclaimScheduler}. */
  public static final class Builder {
    private WorkQueue workQueue;
    private Duration timeout;
    private long intervalSeconds = 300;

    private Builder() {}

    /**
     * Sets the queue whose orphans are reclaimed.
     *
     * <p><b>Required.</b>
     *
     * @param workQueue the work queue
     * @return this builder
     */
    public Builder workQueue(WorkQueue workQueue) {
      this.workQueue = workQueue;
      return this;
    }

    /**
     * Sets the claim age after which a processing row counts as orphaned.
     *
     * <p>Optional. Defaults to the queue's {@code cleanupTimeoutHours}. Must be &ge; 0.
     *
     * @param timeout orphan timeout
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets the interval in seconds between reclaim cycles.
     *
     * <p>Optional. Defaults to {@code 300} (5 minutes). Must be &gt; 0.
     *
     * @param intervalSeconds reclaim interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link OrphanReclaimScheduler#start()} to begin.
     *
     * @return a new {@link OrphanReclaimScheduler} instance
     * @throws NullPointerException if {@code workQueue} is null
     * @throws IllegalArgumentException if {@code timeout} is negative or {@code intervalSeconds <= 0}
     */
    public OrphanReclaimScheduler build() {
      return new OrphanReclaimScheduler(this);
    }
  }
}
