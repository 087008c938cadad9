package workqueue.worker;

/**
 * Outcome counts for one worker cycle.
 *
 * @param claimed   items claimed
 * @param completed items completed
 * @param requeued  items that failed and went back to pending
 * @param failed    items that failed permanently
 * @param conflicts items no longer owned when their outcome was recorded
 */
public record BatchSummary(int claimed, int completed, int requeued, int failed, int conflicts) {

  public static final BatchSummary EMPTY = new BatchSummary(0, 0, 0, 0, 0);
}
