package workqueue.record;

import workqueue.FailureOutcome;
import workqueue.OwnershipConflictException;
import workqueue.model.ItemState;
import workqueue.spi.MetricsExporter;
import workqueue.spi.QueueStore;
import workqueue.store.StoreTemplate;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the outcome of processing a claimed row.
 *
 * <p>Both operations require the row to be {@code processing} under this recorder's
 * instance id. A row that was reclaimed in the meantime, or claimed by someone else,
 * is left untouched and an {@link OwnershipConflictException} is raised.
 */
public final class CompletionRecorder {
  private static final Logger logger = Logger.getLogger(CompletionRecorder.class.getName());

  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;
  private final String instanceId;
  private final int maxRetries;
  private final Clock clock;
  private final MetricsExporter metrics;

  public CompletionRecorder(StoreTemplate storeTemplate, QueueStore queueStore, String instanceId,
      int maxRetries, Clock clock, MetricsExporter metrics) {
    this.storeTemplate = Objects.requireNonNull(storeTemplate, "storeTemplate");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    this.maxRetries = maxRetries;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Marks the row {@code completed} and stores its result.
   *
   * @throws OwnershipConflictException if the row is not processing under this instance
   * @throws workqueue.QueueUnavailableException if the store fails
   */
  public void complete(long id, String resultJson) {
    storeTemplate.inTransaction("complete", conn -> {
      int updated = queueStore.markCompleted(conn, id, instanceId, resultJson, clock.instant());
      if (updated == 0) {
        throw conflict(conn, "complete", id);
      }
      return null;
    });
    metrics.incrementCompleted();
    logger.log(Level.FINE, "Completed item {0}", id);
  }

  /**
   * Records a failed attempt. The row goes back to {@code pending} while
   * {@code retry_count + 1 < maxRetries}, otherwise it becomes {@code failed}.
   *
   * @return {@link FailureOutcome#REQUEUED} or {@link FailureOutcome#FAILED}
   * @throws OwnershipConflictException if the row is not processing under this instance
   * @throws workqueue.QueueUnavailableException if the store fails
   */
  public FailureOutcome fail(long id, String error) {
    FailureOutcome outcome = storeTemplate.inTransaction("fail", conn -> {
      int updated = queueStore.markFailed(conn, id, instanceId, error, maxRetries, clock.instant());
      if (updated == 0) {
        throw conflict(conn, "fail", id);
      }
      ItemState state = queueStore.findState(conn, id)
          .orElseThrow(() -> new IllegalStateException("Item " + id + " vanished after update"));
      return state == ItemState.PENDING ? FailureOutcome.REQUEUED : FailureOutcome.FAILED;
    });
    if (outcome == FailureOutcome.REQUEUED) {
      metrics.incrementRequeued();
      logger.log(Level.FINE, "Requeued item {0} after failure: {1}", new Object[]{id, error});
    } else {
      metrics.incrementFailed();
      logger.log(Level.INFO, "Item {0} failed permanently after {1} attempts: {2}",
          new Object[]{id, maxRetries, error});
    }
    return outcome;
  }

  private OwnershipConflictException conflict(Connection conn, String operation, long id) {
    ItemState current = queueStore.findState(conn, id).orElse(null);
    return new OwnershipConflictException(operation, id, instanceId, current);
  }
}
