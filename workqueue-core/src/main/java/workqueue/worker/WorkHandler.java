package workqueue.worker;

import workqueue.model.ClaimedItem;

/**
 * Processes one claimed item.
 *
 * <p>Returning normally completes the item with the returned result. Throwing records a
 * failed attempt with the exception's message; the item is retried until its retry
 * budget is spent.
 */
@FunctionalInterface
public interface WorkHandler {

  /**
   * @param item the claimed item
   * @return result JSON to store, may be {@code null}
   * @throws Exception on any processing failure
   */
  String handle(ClaimedItem item) throws Exception;
}
