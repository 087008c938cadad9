package workqueue.reclaim;

import workqueue.spi.MetricsExporter;
import workqueue.spi.QueueStore;
import workqueue.store.StoreTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Returns rows stuck in {@code processing} to {@code pending} once their claim is older
 * than a timeout, regardless of which instance claimed them.
 *
 * <p>Recovery is purely time based; there is no liveness channel to the owning worker.
 * The retry count is left unchanged because an orphan reflects a worker failure, not a
 * failure of the work itself. Any instance may run this.
 */
public final class OrphanReclaimer {
  private static final Logger logger = Logger.getLogger(OrphanReclaimer.class.getName());

  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;
  private final Clock clock;
  private final MetricsExporter metrics;

  public OrphanReclaimer(StoreTemplate storeTemplate, QueueStore queueStore, Clock clock,
      MetricsExporter metrics) {
    this.storeTemplate = Objects.requireNonNull(storeTemplate, "storeTemplate");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reclaims rows claimed more than {@code timeout} ago.
   *
   * @param timeout claim age after which a row counts as orphaned;
   *                {@link Duration#ZERO} reclaims every processing row
   * @return number of rows returned to {@code pending}
   * @throws IllegalArgumentException if {@code timeout} is negative
   * @throws workqueue.QueueUnavailableException if the store fails
   */
  public int reclaim(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0, got: " + timeout);
    }
    Instant cutoff = timeout.isZero() ? null : clock.instant().minus(timeout);
    int reclaimed = storeTemplate.inTransaction("reclaimOrphans",
        conn -> queueStore.reclaimOrphans(conn, cutoff));
    if (reclaimed > 0) {
      metrics.incrementReclaimed(reclaimed);
      logger.log(Level.WARNING, "Reclaimed {0} orphaned items (timeout {1})",
          new Object[]{reclaimed, timeout});
    } else {
      logger.log(Level.FINE, "No orphaned items older than {0}", timeout);
    }
    return reclaimed;
  }
}
