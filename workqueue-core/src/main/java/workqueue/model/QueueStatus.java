package workqueue.model;

/**
 * Row counts per state for one category (or for a whole table).
 */
public record QueueStatus(long pending, long processing, long completed, long failed) {

  public static final QueueStatus EMPTY = new QueueStatus(0, 0, 0, 0);

  public long total() {
    return pending + processing + completed + failed;
  }

  /** {@code true} when nothing is waiting or in flight. */
  public boolean isDrained() {
    return pending == 0 && processing == 0;
  }

  public long count(ItemState state) {
    return switch (state) {
      case PENDING -> pending;
      case PROCESSING -> processing;
      case COMPLETED -> completed;
      case FAILED -> failed;
    };
  }

  /** Returns a copy with {@code count} added to the given state. */
  public QueueStatus plus(ItemState state, long count) {
    return switch (state) {
      case PENDING -> new QueueStatus(pending + count, processing, completed, failed);
      case PROCESSING -> new QueueStatus(pending, processing + count, completed, failed);
      case COMPLETED -> new QueueStatus(pending, processing, completed + count, failed);
      case FAILED -> new QueueStatus(pending, processing, completed, failed + count);
    };
  }

  public QueueStatus plus(QueueStatus other) {
    return new QueueStatus(pending + other.pending, processing + other.processing,
        completed + other.completed, failed + other.failed);
  }
}
