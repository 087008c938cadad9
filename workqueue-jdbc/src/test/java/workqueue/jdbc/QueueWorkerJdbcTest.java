package workqueue.jdbc;

import org.junit.jupiter.api.Test;
import workqueue.WorkQueue;
import workqueue.WorkQueueConfig;
import workqueue.jdbc.store.H2QueueStore;
import workqueue.model.ItemState;
import workqueue.model.QueueItem;
import workqueue.model.QueueStatus;
import workqueue.retry.RetryingExecutor;
import workqueue.worker.BatchSummary;
import workqueue.worker.QueueWorker;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueWorkerJdbcTest {

  private final H2QueueStore store = new H2QueueStore();
  private final RetryingExecutor noSleep = new RetryingExecutor(attempts -> 0L, 3, millis -> {
  });

  @Test
  void workerStoresHandlerResultsAndErrors() throws Exception {
    DataSource dataSource = Schemas.h2();
    WorkQueue queue = WorkQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueStore(store)
        .config(WorkQueueConfig.builder().maxRetries(1).build())
        .instanceId("worker-a")
        .build();
    queue.enqueue("invoices", List.of("{\"amount\":10}", "{\"amount\":-1}"));

    QueueWorker worker = QueueWorker.builder()
        .workQueue(queue)
        .category("invoices")
        .retryingExecutor(noSleep)
        .handler(item -> {
          if (item.payloadJson().contains("-1")) {
            throw new IllegalStateException("negative amount");
          }
          return "{\"invoice\":" + item.id() + "}";
        })
        .build();

    BatchSummary summary = worker.runOnce();

    assertEquals(new BatchSummary(2, 1, 0, 1, 0), summary);
    assertEquals(new QueueStatus(0, 0, 1, 1), queue.status("invoices"));
    QueueItem failed = queue.failedItems().list("invoices", 10).get(0);
    assertEquals("IllegalStateException: negative amount", failed.error());
    try (Connection conn = dataSource.getConnection()) {
      QueueItem done = store.findById(conn, failed.id() - 1).orElseThrow();
      assertEquals(ItemState.COMPLETED, done.state());
      assertEquals("{\"invoice\":" + done.id() + "}", done.resultJson());
    }
  }

  @Test
  void startedWorkerDrainsQueue() throws Exception {
    WorkQueue queue = WorkQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(Schemas.h2()))
        .queueStore(store)
        .instanceId("worker-b")
        .build();
    queue.enqueue("emails", List.of("{}", "{}", "{}", "{}", "{}"));

    try (QueueWorker worker = QueueWorker.builder()
        .workQueue(queue)
        .category("emails")
        .batchSize(2)
        .pollInterval(Duration.ofMillis(20))
        .handler(item -> "{\"sent\":true}")
        .build()) {
      worker.start();

      long deadline = System.currentTimeMillis() + 5_000;
      while (!queue.status("emails").isDrained() && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
    }

    assertEquals(new QueueStatus(0, 0, 5, 0), queue.status("emails"));
  }
}
