package workqueue;

/**
 * Result of {@link WorkQueue#fail(long, String)}.
 */
public enum FailureOutcome {
  /** Retries remain; the item is {@code pending} again with an incremented retry count. */
  REQUEUED,
  /** Retry budget exhausted; the item is terminally {@code failed}. */
  FAILED,
  /** The item was not processing under this instance; nothing changed. */
  NOT_OWNED
}
