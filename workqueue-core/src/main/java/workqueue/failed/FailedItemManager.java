package workqueue.failed;

import workqueue.model.Category;
import workqueue.model.QueueItem;
import workqueue.spi.QueueStore;
import workqueue.store.StoreTemplate;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for querying, counting, and replaying items that exhausted their retries.
 *
 * <p>Replay puts a failed row back to {@code pending} with a zero retry count and cleared
 * ownership and error. Nothing here runs automatically.
 *
 * @see QueueStore#queryFailed
 * @see QueueStore#replayFailed
 * @see QueueStore#countFailed
 */
public final class FailedItemManager {
  private static final Logger logger = Logger.getLogger(FailedItemManager.class.getName());

  private final StoreTemplate storeTemplate;
  private final QueueStore queueStore;

  public FailedItemManager(StoreTemplate storeTemplate, QueueStore queueStore) {
    this.storeTemplate = Objects.requireNonNull(storeTemplate, "storeTemplate");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
  }

  /**
   * @param category queue category
   * @param limit    maximum number of items to return
   * @return failed items, oldest first
   */
  public List<QueueItem> list(String category, int limit) {
    Category.validate(category);
    requirePositive(limit, "limit");
    return storeTemplate.withConnection("queryFailed",
        conn -> queueStore.queryFailed(conn, category, limit));
  }

  public long count(String category) {
    Category.validate(category);
    return storeTemplate.withConnection("countFailed", conn -> queueStore.countFailed(conn, category));
  }

  /**
   * Replays a single failed item.
   *
   * @return {@code true} if replayed, {@code false} if the item is missing or not failed
   */
  public boolean replay(long id) {
    boolean replayed = storeTemplate.withConnection("replayFailed",
        conn -> queueStore.replayFailed(conn, id)) > 0;
    if (replayed) {
      logger.log(Level.FINE, "Replayed failed item {0}", id);
    }
    return replayed;
  }

  /**
   * Replays every failed item of a category, {@code batchSize} at a time.
   *
   * @return total number of items replayed
   */
  public int replayAll(String category, int batchSize) {
    Category.validate(category);
    requirePositive(batchSize, "batchSize");
    int totalReplayed = 0;
    List<QueueItem> batch;
    do {
      batch = list(category, batchSize);
      int batchReplayed = 0;
      for (QueueItem item : batch) {
        if (replay(item.id())) {
          batchReplayed++;
        }
      }
      totalReplayed += batchReplayed;
      if (batchReplayed == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    if (totalReplayed > 0) {
      logger.log(Level.INFO, "Replayed {0} failed items in category {1}",
          new Object[]{totalReplayed, category});
    }
    return totalReplayed;
  }

  private static void requirePositive(int value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
  }
}
