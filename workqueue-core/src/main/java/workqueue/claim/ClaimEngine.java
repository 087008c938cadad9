package workqueue.claim;

import workqueue.model.ClaimedItem;
import workqueue.spi.MetricsExporter;
import workqueue.spi.QueueStore;
import workqueue.store.StoreTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Takes ownership of batches of pending rows.
 *
 * <p>Selection and the ownership update run in one transaction, and the store skips
 * rows already locked by another transaction, so concurrent claimers (threads, processes
 * or hosts) receive disjoint sets of rows. Ordering is oldest first, but a row that is
 * momentarily locked elsewhere may be passed over in favour of a younger one.
 */
public final class ClaimEngine {
  private static final Logger logger = Logger.getLogger(ClaimEngine.class.getName());

  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;
  private final String instanceId;
  private final Clock clock;
  private final MetricsExporter metrics;

  public ClaimEngine(StoreTemplate storeTemplate, QueueStore queueStore, String instanceId,
      Clock clock, MetricsExporter metrics) {
    this.storeTemplate = Objects.requireNonNull(storeTemplate, "storeTemplate");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Claims up to {@code batchSize} pending rows of {@code category}.
   *
   * @return claimed rows oldest first; empty when nothing is eligible
   * @throws workqueue.QueueUnavailableException if the store fails
   */
  public List<ClaimedItem> claim(String category, int batchSize) {
    Instant now = clock.instant();
    List<ClaimedItem> claimed = storeTemplate.inTransaction("claim",
        conn -> queueStore.claim(conn, category, instanceId, now, batchSize));
    if (claimed.isEmpty()) {
      logger.log(Level.FINE, "No pending items in category {0}", category);
    } else {
      metrics.incrementClaimed(claimed.size());
      logger.log(Level.INFO, "Instance {0} claimed {1} items from category {2}",
          new Object[]{instanceId, claimed.size(), category});
    }
    return claimed;
  }
}
