package workqueue;

import workqueue.model.ClaimedItem;
import workqueue.model.ItemState;
import workqueue.model.QueueItem;
import workqueue.model.QueueStatus;
import workqueue.spi.QueueStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-backed {@link QueueStore} with the same row semantics as the JDBC stores.
 * Methods are synchronized, which stands in for row locking.
 */
public class InMemoryQueueStore implements QueueStore {
  private final Map<Long, QueueItem> rows = new TreeMap<>();
  private long nextId = 1;

  @Override
  public synchronized int insertBatch(Connection conn, String category, List<String> payloads, Instant now) {
    for (String payload : payloads) {
      long id = nextId++;
      rows.put(id, new QueueItem(id, category, payload, ItemState.PENDING, 0,
          null, null, now, null, null, null));
    }
    return payloads.size();
  }

  @Override
  public synchronized List<ClaimedItem> claim(Connection conn, String category, String ownerId,
      Instant now, int limit) {
    List<QueueItem> candidates = rows.values().stream()
        .filter(r -> r.category().equals(category) && r.state() == ItemState.PENDING)
        .sorted(Comparator.comparing(QueueItem::createdAt).thenComparingLong(QueueItem::id))
        .limit(limit)
        .toList();
    List<ClaimedItem> claimed = new ArrayList<>();
    for (QueueItem r : candidates) {
      rows.put(r.id(), new QueueItem(r.id(), r.category(), r.payloadJson(), ItemState.PROCESSING,
          r.retryCount(), ownerId, now, r.createdAt(), r.completedAt(), r.resultJson(), r.error()));
      claimed.add(new ClaimedItem(r.id(), r.category(), r.payloadJson(), r.retryCount(), r.createdAt()));
    }
    return claimed;
  }

  @Override
  public synchronized int markCompleted(Connection conn, long id, String ownerId, String resultJson, Instant now) {
    QueueItem r = rows.get(id);
    if (!owned(r, ownerId)) {
      return 0;
    }
    rows.put(id, new QueueItem(id, r.category(), r.payloadJson(), ItemState.COMPLETED,
        r.retryCount(), null, r.claimedAt(), r.createdAt(), now, resultJson, r.error()));
    return 1;
  }

  @Override
  public synchronized int markFailed(Connection conn, long id, String ownerId, String error,
      int maxRetries, Instant now) {
    QueueItem r = rows.get(id);
    if (!owned(r, ownerId)) {
      return 0;
    }
    boolean requeue = r.retryCount() + 1 < maxRetries;
    rows.put(id, new QueueItem(id, r.category(), r.payloadJson(),
        requeue ? ItemState.PENDING : ItemState.FAILED, r.retryCount() + 1, null,
        requeue ? null : r.claimedAt(), r.createdAt(), requeue ? r.completedAt() : now,
        r.resultJson(), error));
    return 1;
  }

  @Override
  public synchronized Optional<ItemState> findState(Connection conn, long id) {
    return Optional.ofNullable(rows.get(id)).map(QueueItem::state);
  }

  @Override
  public synchronized Optional<QueueItem> findById(Connection conn, long id) {
    return Optional.ofNullable(rows.get(id));
  }

  @Override
  public synchronized int reclaimOrphans(Connection conn, Instant cutoff) {
    int count = 0;
    for (QueueItem r : List.copyOf(rows.values())) {
      if (r.state() == ItemState.PROCESSING && (cutoff == null || r.claimedAt().isBefore(cutoff))) {
        rows.put(r.id(), new QueueItem(r.id(), r.category(), r.payloadJson(), ItemState.PENDING,
            r.retryCount(), null, null, r.createdAt(), r.completedAt(), r.resultJson(), r.error()));
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized QueueStatus countByState(Connection conn, String category) {
    QueueStatus status = QueueStatus.EMPTY;
    for (QueueItem r : rows.values()) {
      if (r.category().equals(category)) {
        status = status.plus(r.state(), 1);
      }
    }
    return status;
  }

  @Override
  public synchronized Map<String, QueueStatus> countByCategory(Connection conn) {
    Map<String, QueueStatus> result = new TreeMap<>();
    for (QueueItem r : rows.values()) {
      result.merge(r.category(), QueueStatus.EMPTY.plus(r.state(), 1), QueueStatus::plus);
    }
    return result;
  }

  @Override
  public synchronized List<QueueItem> queryFailed(Connection conn, String category, int limit) {
    return rows.values().stream()
        .filter(r -> r.category().equals(category) && r.state() == ItemState.FAILED)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized int replayFailed(Connection conn, long id) {
    QueueItem r = rows.get(id);
    if (r == null || r.state() != ItemState.FAILED) {
      return 0;
    }
    rows.put(id, new QueueItem(id, r.category(), r.payloadJson(), ItemState.PENDING, 0,
        null, null, r.createdAt(), null, null, null));
    return 1;
  }

  @Override
  public synchronized long countFailed(Connection conn, String category) {
    return countByState(conn, category).failed();
  }

  public synchronized QueueItem row(long id) {
    return rows.get(id);
  }

  private static boolean owned(QueueItem row, String ownerId) {
    return row != null && row.state() == ItemState.PROCESSING && ownerId.equals(row.claimedBy());
  }
}
