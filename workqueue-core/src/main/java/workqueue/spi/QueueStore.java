package workqueue.spi;

import workqueue.model.ClaimedItem;
import workqueue.model.ItemState;
import workqueue.model.QueueItem;
import workqueue.model.QueueStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence operations for the queue table.
 *
 * <p>Every method works on the connection it is given and never commits; transaction
 * boundaries belong to the caller. Implementations report failures with unchecked
 * exceptions, which the core translates into {@link workqueue.QueueUnavailableException}.
 *
 * @see workqueue.jdbc.store.AbstractJdbcQueueStore
 */
public interface QueueStore {

  /**
   * Inserts one {@code pending} row per payload.
   *
   * @return number of rows inserted
   */
  int insertBatch(Connection conn, String category, List<String> payloads, Instant now);

  /**
   * Takes ownership of up to {@code limit} pending rows of {@code category}, oldest first,
   * skipping rows locked by concurrent transactions instead of waiting for them.
   *
   * <p>Two concurrent calls must never return the same row id.
   *
   * @return the claimed rows, possibly empty
   */
  List<ClaimedItem> claim(Connection conn, String category, String ownerId, Instant now, int limit);

  /**
   * Marks a row {@code completed} if it is processing under {@code ownerId}.
   *
   * @return 1 if updated, 0 if the row is not owned
   */
  int markCompleted(Connection conn, long id, String ownerId, String resultJson, Instant now);

  /**
   * Records a failed attempt in one statement: requeues the row when
   * {@code retry_count + 1 < maxRetries}, otherwise marks it {@code failed}.
   * The retry count is incremented in both cases.
   *
   * @return 1 if updated, 0 if the row is not owned
   */
  int markFailed(Connection conn, long id, String ownerId, String error, int maxRetries, Instant now);

  Optional<ItemState> findState(Connection conn, long id);

  Optional<QueueItem> findById(Connection conn, long id);

  /**
   * Resets {@code processing} rows claimed before {@code cutoff} to {@code pending}
   * without touching their retry count.
   *
   * @param cutoff claim-time cutoff, or {@code null} to reset every processing row
   * @return number of rows reset
   */
  int reclaimOrphans(Connection conn, Instant cutoff);

  QueueStatus countByState(Connection conn, String category);

  /** Counts per category, ordered by category name. */
  Map<String, QueueStatus> countByCategory(Connection conn);

  /** Failed rows of a category, oldest first. */
  List<QueueItem> queryFailed(Connection conn, String category, int limit);

  /**
   * Resets a {@code failed} row to {@code pending} with a zero retry count.
   *
   * @return 1 if replayed, 0 if the row is missing or not failed
   */
  int replayFailed(Connection conn, long id);

  long countFailed(Connection conn, String category);
}
