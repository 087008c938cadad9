package workqueue.model;

/**
 * Lifecycle states of a queue row.
 *
 * <pre>
 * pending --claim--> processing --complete--> completed
 * processing --fail (retries left)--> pending
 * processing --fail (retries exhausted)--> failed
 * processing --orphan timeout--> pending
 * </pre>
 */
public enum ItemState {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String dbValue;

  ItemState(String dbValue) {
    this.dbValue = dbValue;
  }

  /** Value stored in the {@code state} column. */
  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static ItemState fromDbValue(String value) {
    for (ItemState state : values()) {
      if (state.dbValue.equals(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown item state: " + value);
  }
}
