package workqueue;

import workqueue.claim.ClaimEngine;
import workqueue.failed.FailedItemManager;
import workqueue.health.ConnectionHealthCheck;
import workqueue.health.HealthMonitor;
import workqueue.health.HealthReport;
import workqueue.model.Category;
import workqueue.model.ClaimedItem;
import workqueue.model.QueueStatus;
import workqueue.reclaim.OrphanReclaimer;
import workqueue.record.CompletionRecorder;
import workqueue.spi.BackingStoreCheck;
import workqueue.spi.ConnectionProvider;
import workqueue.spi.MetricsExporter;
import workqueue.spi.QueueStore;
import workqueue.status.StatusReporter;
import workqueue.store.StoreTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable work queue bound to one store, one validated configuration and one
 * instance identity.
 *
 * <p>Multiple instances (threads, processes or hosts) may share a table. They never
 * coordinate directly; exclusion comes entirely from the store's row locking, so two
 * concurrent claims never return the same row.
 *
 * <p>Every store failure surfaces as {@link QueueUnavailableException}. Completing or
 * failing an item this instance no longer owns is logged and reported through the
 * return value instead of thrown.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * WorkQueue queue = WorkQueue.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .queueStore(JdbcQueueStores.detect(dataSource))
 *     .config(WorkQueueConfig.builder().maxRetries(5).build())
 *     .build();
 *
 * queue.enqueue("orders", List.of("{\"orderId\":1}", "{\"orderId\":2}"));
 * for (ClaimedItem item : queue.claim("orders", 10)) {
 *   try {
 *     queue.complete(item.id(), process(item.payloadJson()));
 *   } catch (Exception e) {
 *     queue.fail(item.id(), e.getMessage());
 *   }
 * }
 * }</pre>
 *
 * @see WorkQueue.Builder
 */
public final class WorkQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkQueue.class.getName());

  private final WorkQueueConfig config;
  private final String instanceId;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;
  private final ClaimEngine claimEngine;
  private final CompletionRecorder recorder;
  private final OrphanReclaimer reclaimer;
  private final StatusReporter statusReporter;
  private final FailedItemManager failedItemManager;
  private final HealthMonitor healthMonitor;

  private WorkQueue(Builder builder) {
    ConnectionProvider connectionProvider =
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.config = builder.config != null ? builder.config : WorkQueueConfig.defaults();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.instanceId != null && builder.instanceId.isBlank()) {
      throw new ConfigurationException("instanceId", "must not be blank");
    }
    this.instanceId = builder.instanceId != null ? builder.instanceId : InstanceIds.generate();

    this.storeTemplate = new StoreTemplate(connectionProvider, metrics);
    this.claimEngine = new ClaimEngine(storeTemplate, queueStore, instanceId, clock, metrics);
    this.recorder = new CompletionRecorder(storeTemplate, queueStore, instanceId,
        config.maxRetries(), clock, metrics);
    this.reclaimer = new OrphanReclaimer(storeTemplate, queueStore, clock, metrics);
    this.statusReporter = new StatusReporter(storeTemplate, queueStore, metrics);
    this.failedItemManager = new FailedItemManager(storeTemplate, queueStore);

    HealthMonitor.Builder health = HealthMonitor.builder()
        .check(new ConnectionHealthCheck(WorkQueueConfig.QUEUE_STORE, connectionProvider))
        .requiredStores(config.requiredBackingStores())
        .queueCounts(statusReporter::statusByCategory)
        .instanceId(instanceId)
        .hostname(InstanceIds.hostname())
        .clock(clock)
        .intervalSeconds(config.healthCheckIntervalSeconds());
    builder.backingStores.forEach(health::check);
    this.healthMonitor = health.build();

    logger.log(Level.INFO, "Work queue instance {0} initialized with {1}", new Object[]{instanceId, config});
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Adds one {@code pending} row per payload. Rows are claimable once this call returns.
   *
   * @param category queue category
   * @param payloads JSON payloads; may be empty
   * @return number of rows created
   * @throws IllegalArgumentException  if the category is invalid or a payload is null
   * @throws QueueUnavailableException if the store fails; no rows are created
   */
  public int enqueue(String category, List<String> payloads) {
    Category.validate(category);
    Objects.requireNonNull(payloads, "payloads");
    List<String> copy = new ArrayList<>(payloads.size());
    for (String payload : payloads) {
      if (payload == null) {
        throw new IllegalArgumentException("payloads must not contain null");
      }
      copy.add(payload);
    }
    if (copy.isEmpty()) {
      return 0;
    }
    int inserted = storeTemplate.inTransaction("enqueue",
        conn -> queueStore.insertBatch(conn, category, copy, clock.instant()));
    metrics.incrementEnqueued(inserted);
    logger.log(Level.FINE, "Enqueued {0} items into category {1}", new Object[]{inserted, category});
    return inserted;
  }

  /** Claims up to the configured {@code batchSize} rows. */
  public List<ClaimedItem> claim(String category) {
    return claim(category, config.batchSize());
  }

  /**
   * Claims up to {@code batchSize} pending rows, oldest first. The rows are owned by
   * this instance until completed, failed or reclaimed.
   *
   * @return claimed rows; empty when nothing is pending or the queue is disabled
   * @throws IllegalArgumentException  if {@code batchSize} is outside 1..1000
   * @throws QueueUnavailableException if the store fails; nothing is claimed
   */
  public List<ClaimedItem> claim(String category, int batchSize) {
    Category.validate(category);
    if (batchSize < WorkQueueConfig.MIN_BATCH_SIZE || batchSize > WorkQueueConfig.MAX_BATCH_SIZE) {
      throw new IllegalArgumentException("batchSize must be between " + WorkQueueConfig.MIN_BATCH_SIZE +
          " and " + WorkQueueConfig.MAX_BATCH_SIZE + ", got: " + batchSize);
    }
    if (!config.enabled()) {
      logger.log(Level.FINE, "Queue disabled, not claiming from {0}", category);
      return List.of();
    }
    return claimEngine.claim(category, batchSize);
  }

  /**
   * Marks an owned item completed.
   *
   * @return {@code true} if recorded, {@code false} if this instance no longer owns the item
   * @throws QueueUnavailableException if the store fails
   */
  public boolean complete(long id, String resultJson) {
    try {
      recorder.complete(id, resultJson);
      return true;
    } catch (OwnershipConflictException e) {
      metrics.incrementOwnershipConflicts();
      logger.log(Level.WARNING, e.getMessage());
      return false;
    }
  }

  /**
   * Records a failed attempt for an owned item.
   *
   * @return whether the item was requeued, failed permanently, or not owned
   * @throws QueueUnavailableException if the store fails
   */
  public FailureOutcome fail(long id, String error) {
    try {
      return recorder.fail(id, error);
    } catch (OwnershipConflictException e) {
      metrics.incrementOwnershipConflicts();
      logger.log(Level.WARNING, e.getMessage());
      return FailureOutcome.NOT_OWNED;
    }
  }

  /** Reclaims rows processing for longer than {@code cleanupTimeoutHours}. */
  public int reclaimOrphans() {
    return reclaimOrphans(config.cleanupTimeout());
  }

  /**
   * Returns rows processing for longer than {@code timeout} to {@code pending}.
   *
   * @param timeout orphan timeout; {@link Duration#ZERO} reclaims every processing row
   * @return number of rows reclaimed
   */
  public int reclaimOrphans(Duration timeout) {
    return reclaimer.reclaim(timeout);
  }

  public QueueStatus status(String category) {
    Category.validate(category);
    return statusReporter.status(category);
  }

  /** Counts for every category, ordered by category name. */
  public Map<String, QueueStatus> statusByCategory() {
    return statusReporter.statusByCategory();
  }

  public FailedItemManager failedItems() {
    return failedItemManager;
  }

  /** Runs a health check now. */
  public HealthReport healthCheck() {
    return healthMonitor.check();
  }

  /** Monitor behind {@link #healthCheck()}; call {@link HealthMonitor#start()} for periodic checks. */
  public HealthMonitor healthMonitor() {
    return healthMonitor;
  }

  public String instanceId() {
    return instanceId;
  }

  public WorkQueueConfig config() {
    return config;
  }

  /** Stops the health monitor if it was started. Rows owned by this instance stay claimed. */
  @Override
  public void close() {
    healthMonitor.close();
  }

  /** Builder for {@link WorkQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private WorkQueueConfig config;
    private String instanceId;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<BackingStoreCheck> backingStores = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the connection provider for the queue table.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store implementation for the target database.
     *
     * <p><b>Required.</b>
     *
     * @param queueStore the queue store
     * @return this builder
     */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * Optional. Defaults to {@link WorkQueueConfig#defaults()}.
     *
     * @param config validated configuration
     * @return this builder
     */
    public Builder config(WorkQueueConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the identity written into {@code claimed_by}.
     *
     * <p>Optional. Defaults to {@code <hostname>-<8 hex chars>}.
     *
     * @param instanceId instance identity
     * @return this builder
     */
    public Builder instanceId(String instanceId) {
      this.instanceId = instanceId;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock clock for claim, completion and orphan timestamps
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Registers an additional backing store probe. The {@code queue} store is always
     * registered automatically.
     *
     * @param check store probe
     * @return this builder
     */
    public Builder backingStore(BackingStoreCheck check) {
      backingStores.add(Objects.requireNonNull(check, "check"));
      return this;
    }

    /**
     * @return a new work queue
     * @throws NullPointerException   if {@code connectionProvider} or {@code queueStore} is null
     * @throws ConfigurationException if a required backing store has no registered check
     */
    public WorkQueue build() {
      return new WorkQueue(this);
    }
  }
}
