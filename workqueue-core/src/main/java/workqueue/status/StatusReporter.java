package workqueue.status;

import workqueue.model.QueueStatus;
import workqueue.spi.MetricsExporter;
import workqueue.spi.QueueStore;
import workqueue.store.StoreTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * Read-only row counts per state.
 */
public final class StatusReporter {
  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;
  private final MetricsExporter metrics;

  public StatusReporter(StoreTemplate storeTemplate, QueueStore queueStore, MetricsExporter metrics) {
    this.storeTemplate = Objects.requireNonNull(storeTemplate, "storeTemplate");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public QueueStatus status(String category) {
    QueueStatus status = storeTemplate.withConnection("status",
        conn -> queueStore.countByState(conn, category));
    metrics.recordPendingDepth(category, status.pending());
    return status;
  }

  /** Counts for every category present in the table, ordered by category. */
  public Map<String, QueueStatus> statusByCategory() {
    Map<String, QueueStatus> byCategory = storeTemplate.withConnection("statusByCategory",
        queueStore::countByCategory);
    byCategory.forEach((category, status) -> metrics.recordPendingDepth(category, status.pending()));
    return byCategory;
  }
}
