package workqueue;

import workqueue.model.ItemState;

/**
 * Raised when completing or failing an item that is no longer {@code processing}
 * under this instance's ownership, typically because it was reclaimed as an orphan.
 *
 * <p>{@link WorkQueue} catches this and reports it as a warning; it only escapes
 * from the lower-level {@link workqueue.record.CompletionRecorder}.
 */
public final class OwnershipConflictException extends WorkQueueException {
  private final long itemId;
  private final String instanceId;
  private final ItemState currentState;

  public OwnershipConflictException(String operation, long itemId, String instanceId, ItemState currentState) {
    super("Cannot " + operation + " item " + itemId + ": not processing under owner " + instanceId +
        " (current state: " + (currentState == null ? "missing" : currentState.dbValue()) + ")");
    this.itemId = itemId;
    this.instanceId = instanceId;
    this.currentState = currentState;
  }

  public long itemId() {
    return itemId;
  }

  public String instanceId() {
    return instanceId;
  }

  /** State observed when the conflict was detected, or {@code null} if the row does not exist. */
  public ItemState currentState() {
    return currentState;
  }
}
