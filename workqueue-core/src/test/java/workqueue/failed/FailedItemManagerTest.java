package workqueue.failed;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import workqueue.FailureOutcome;
import workqueue.InMemoryQueueStore;
import workqueue.TestConnections;
import workqueue.WorkQueue;
import workqueue.WorkQueueConfig;
import workqueue.model.ClaimedItem;
import workqueue.model.ItemState;
import workqueue.model.QueueItem;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailedItemManagerTest {

  private InMemoryQueueStore store;
  private WorkQueue queue;

  @BeforeEach
  void setUp() {
    store = new InMemoryQueueStore();
    queue = WorkQueue.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .queueStore(store)
        .config(WorkQueueConfig.builder().maxRetries(1).build())
        .instanceId("worker-a")
        .build();
  }

  private void failAll(String category, int count) {
    queue.enqueue(category, Collections.nCopies(count, "{}"));
    for (ClaimedItem item : queue.claim(category, count)) {
      assertEquals(FailureOutcome.FAILED, queue.fail(item.id(), "broken"));
    }
  }

  @Test
  void listAndCount() {
    failAll("orders", 3);
    failAll("invoices", 1);

    List<QueueItem> failed = queue.failedItems().list("orders", 2);

    assertEquals(2, failed.size());
    assertEquals("broken", failed.get(0).error());
    assertEquals(3, queue.failedItems().count("orders"));
    assertEquals(1, queue.failedItems().count("invoices"));
  }

  @Test
  void replayResetsRetryBudget() {
    failAll("orders", 1);
    long id = queue.failedItems().list("orders", 1).get(0).id();

    assertTrue(queue.failedItems().replay(id));

    QueueItem row = store.row(id);
    assertEquals(ItemState.PENDING, row.state());
    assertEquals(0, row.retryCount());
    assertNull(row.error());
    assertFalse(queue.failedItems().replay(id));
  }

  @Test
  void replayAllWorksInBatches() {
    failAll("orders", 5);

    assertEquals(5, queue.failedItems().replayAll("orders", 2));

    assertEquals(0, queue.failedItems().count("orders"));
    assertEquals(5, queue.status("orders").pending());
  }

  @Test
  void argumentsValidated() {
    FailedItemManager manager = queue.failedItems();

    assertThrows(IllegalArgumentException.class, () -> manager.list("orders", 0));
    assertThrows(IllegalArgumentException.class, () -> manager.replayAll("orders", -1));
    assertThrows(NullPointerException.class, () -> manager.count(null));
  }
}
