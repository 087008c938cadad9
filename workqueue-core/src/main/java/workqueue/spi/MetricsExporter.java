package workqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  void incrementEnqueued(int count);

  void incrementClaimed(int count);

  void incrementCompleted();

  /** A failed item was put back to {@code pending}. */
  void incrementRequeued();

  /** A failed item exhausted its retries. */
  void incrementFailed();

  void incrementReclaimed(int count);

  /** Completion or failure was reported for an item this instance no longer owns. */
  void incrementOwnershipConflicts();

  /** A store operation failed and was reported as unavailable. */
  void incrementStoreErrors();

  /**
   * Records the last observed number of pending rows in a category.
   *
   * @param category queue category
   * @param depth    pending row count
   */
  void recordPendingDepth(String category, long depth);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued(int count) {
    }

    @Override
    public void incrementClaimed(int count) {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementRequeued() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementReclaimed(int count) {
    }

    @Override
    public void incrementOwnershipConflicts() {
    }

    @Override
    public void incrementStoreErrors() {
    }

    @Override
    public void recordPendingDepth(String category, long depth) {
    }
  }
}
