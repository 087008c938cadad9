package workqueue.health;

import workqueue.ConfigurationException;
import workqueue.WorkQueueConfig;
import workqueue.WorkQueueException;
import workqueue.model.QueueStatus;
import workqueue.spi.BackingStoreCheck;
import workqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Aggregates backing-store probes into a {@link HealthReport}.
 *
 * <p>A failing store named in {@code requiredBackingStores} makes the report
 * {@link HealthStatus#UNHEALTHY}. Any other failing store, or any store slower than
 * one second, makes it {@link HealthStatus#DEGRADED}.
 *
 * <p>{@link #start()} re-runs the check on a daemon thread at a fixed delay and logs
 * each outcome. Create instances via {@link #builder()}.
 */
public final class HealthMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());
  static final long SLOW_THRESHOLD_MS = 1000;

  private final Map<String, BackingStoreCheck> checks;
  private final Set<String> requiredStores;
  private final Supplier<Map<String, QueueStatus>> queueCounts;
  private final String instanceId;
  private final String hostname;
  private final Clock clock;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> checkTask;
  private volatile HealthReport lastReport;
  private volatile boolean closed;

  private HealthMonitor(Builder builder) {
    this.instanceId = Objects.requireNonNull(builder.instanceId, "instanceId");
    this.hostname = Objects.requireNonNull(builder.hostname, "hostname");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.queueCounts = builder.queueCounts;
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;

    Map<String, BackingStoreCheck> byName = new LinkedHashMap<>();
    for (BackingStoreCheck check : builder.checks) {
      if (byName.putIfAbsent(check.name(), check) != null) {
        throw new ConfigurationException("backingStores",
            "duplicate health check for store '" + check.name() + "'");
      }
    }
    for (String required : builder.requiredStores) {
      if (!byName.containsKey(required)) {
        throw new ConfigurationException("requiredBackingStores",
            "no health check registered for required store '" + required + "'");
      }
    }
    this.checks = Collections.unmodifiableMap(byName);
    this.requiredStores = Set.copyOf(builder.requiredStores);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Probes every registered store and reads queue counts.
   *
   * @return the new report, also available from {@link #lastReport()}
   */
  public HealthReport check() {
    Map<String, StoreHealth> results = new LinkedHashMap<>();
    HealthStatus status = HealthStatus.HEALTHY;
    for (BackingStoreCheck check : checks.values()) {
      StoreHealth health = probe(check);
      results.put(check.name(), health);
      if (!health.connected()) {
        status = requiredStores.contains(check.name())
            ? HealthStatus.UNHEALTHY
            : worst(status, HealthStatus.DEGRADED);
      } else if (health.isSlow(SLOW_THRESHOLD_MS)) {
        status = worst(status, HealthStatus.DEGRADED);
      }
    }

    Map<String, QueueStatus> counts = null;
    StoreHealth queueHealth = results.get(WorkQueueConfig.QUEUE_STORE);
    if (queueCounts != null && (queueHealth == null || queueHealth.connected())) {
      try {
        counts = queueCounts.get();
      } catch (WorkQueueException e) {
        logger.log(Level.FINE, "Queue counts unavailable during health check", e);
        status = worst(status, HealthStatus.DEGRADED);
      }
    }

    HealthReport report = new HealthReport(status, Collections.unmodifiableMap(results),
        counts, instanceId, hostname, clock.instant());
    lastReport = report;
    return report;
  }

  /** Most recent report, or {@code null} if no check has run yet. */
  public HealthReport lastReport() {
    return lastReport;
  }

  /**
   * Starts periodic checks. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HealthMonitor has been closed");
    }
    if (checkTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("workqueue-health-"));
    checkTask = scheduler.scheduleWithFixedDelay(
        this::runScheduled, 0, intervalSeconds, TimeUnit.SECONDS);
  }

  private void runScheduled() {
    if (closed) {
      return;
    }
    try {
      HealthReport report = check();
      switch (report.status()) {
        case HEALTHY -> logger.log(Level.INFO, "Health check passed for {0}", instanceId);
        case DEGRADED -> logger.log(Level.WARNING, "Health degraded for {0}: {1}",
            new Object[]{instanceId, report.stores().values()});
        case UNHEALTHY -> logger.log(Level.SEVERE, "Health check failed for {0}: {1}",
            new Object[]{instanceId, report.stores().values()});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health check cycle failed", t);
    }
  }

  /** Cancels periodic checks and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (checkTask != null) {
      checkTask.cancel(false);
      checkTask = null;
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

  private static StoreHealth probe(BackingStoreCheck check) {
    try {
      return check.check();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Health check for store " + check.name() + " threw", e);
      return StoreHealth.down(check.name(), 0, String.valueOf(e.getMessage()));
    }
  }

  private static HealthStatus worst(HealthStatus a, HealthStatus b) {
    return a.ordinal() >= b.ordinal() ? a : b;
  }

  /** Builder for {@link HealthMonitor}. */
  public static final class Builder {
    private final List<BackingStoreCheck> checks = new ArrayList<>();
    private Set<String> requiredStores = Set.of();
    private Supplier<Map<String, QueueStatus>> queueCounts;
    private String instanceId;
    private String hostname;
    private Clock clock = Clock.systemUTC();
    private long intervalSeconds = 300;

    private Builder() {}

    /**
     * Registers a store probe. Store names must be unique.
     *
     * @param check the probe
     * @return this builder
     */
    public Builder check(BackingStoreCheck check) {
      checks.add(Objects.requireNonNull(check, "check"));
      return this;
    }

    /**
     * Sets the store names whose failure makes the instance unhealthy.
     * Each needs a registered check.
     *
     * @param requiredStores store names
     * @return this builder
     */
    public Builder requiredStores(Set<String> requiredStores) {
      this.requiredStores = new LinkedHashSet<>(Objects.requireNonNull(requiredStores, "requiredStores"));
      return this;
    }

    /**
     * Sets the source of per-category counts included in reports.
     *
     * <p>Optional. Reports carry no counts when unset.
     *
     * @param queueCounts count supplier
     * @return this builder
     */
    public Builder queueCounts(Supplier<Map<String, QueueStatus>> queueCounts) {
      this.queueCounts = queueCounts;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param instanceId reporting instance identity
     * @return this builder
     */
    public Builder instanceId(String instanceId) {
      this.instanceId = instanceId;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param hostname reporting host name
     * @return this builder
     */
    public Builder hostname(String hostname) {
      this.hostname = hostname;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock clock used for report timestamps
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the interval between scheduled checks.
     *
     * <p>Optional. Defaults to {@code 300}. Must be &gt; 0.
     *
     * @param intervalSeconds check interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * @return a new monitor; call {@link HealthMonitor#start()} for periodic checks
     * @throws ConfigurationException if a required store has no check or a name is registered twice
     */
    public HealthMonitor build() {
      return new HealthMonitor(this);
    }
  }
}
