package workqueue.demo;

import org.h2.jdbcx.JdbcDataSource;
import workqueue.FailureOutcome;
import workqueue.WorkQueue;
import workqueue.WorkQueueConfig;
import workqueue.jdbc.DataSourceConnectionProvider;
import workqueue.jdbc.store.AbstractJdbcQueueStore;
import workqueue.jdbc.store.JdbcQueueStores;
import workqueue.model.ClaimedItem;
import workqueue.model.QueueItem;
import workqueue.worker.BatchSummary;
import workqueue.worker.QueueWorker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks through a worker crash and its recovery by a second instance, without Spring.
 *
 * Run with: mvn -pl samples/workqueue-demo exec:java -Dexec.mainClass=workqueue.demo.WorkQueueDemo
 */
public final class WorkQueueDemo {

  public static void main(String[] args) throws Exception {
    // 1. Setup H2 in-memory database
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:demo;DB_CLOSE_DELAY=-1");
    createSchema(dataSource);

    AbstractJdbcQueueStore store = JdbcQueueStores.detect(dataSource);
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    WorkQueueConfig config = WorkQueueConfig.builder()
        .batchSize(10)
        .maxRetries(1)
        .build();

    // 2. Two instances sharing one table
    WorkQueue instanceA = WorkQueue.builder()
        .connectionProvider(connectionProvider)
        .queueStore(store)
        .config(config)
        .build();
    WorkQueue instanceB = WorkQueue.builder()
        .connectionProvider(connectionProvider)
        .queueStore(store)
        .config(config)
        .build();
    System.out.println("Instance A: " + instanceA.instanceId());
    System.out.println("Instance B: " + instanceB.instanceId());

    // 3. Enqueue 20 orders
    List<String> orders = new ArrayList<>();
    for (int i = 1; i <= 20; i++) {
      orders.add("{\"orderId\":" + i + ",\"amount\":" + (i * 10) + "}");
    }
    instanceA.enqueue("orders", orders);
    System.out.println("After enqueue:   " + instanceA.status("orders"));

    // 4. Instance A claims a batch and "crashes"
    List<ClaimedItem> lost = instanceA.claim("orders");
    System.out.println("A claimed " + lost.size() + " items and stopped responding");
    System.out.println("After crash:     " + instanceB.status("orders"));

    // 5. Instance B reclaims the orphans
    int reclaimed = instanceB.reclaimOrphans(Duration.ZERO);
    System.out.println("B reclaimed " + reclaimed + " orphans");
    System.out.println("After reclaim:   " + instanceB.status("orders"));

    // 6. Instance B drains the queue; orders over 180 are rejected
    try (QueueWorker worker = QueueWorker.builder()
        .workQueue(instanceB)
        .category("orders")
        .batchSize(20)
        .handler(item -> {
          if (item.payloadJson().contains("\"amount\":190") || item.payloadJson().contains("\"amount\":200")) {
            throw new IllegalArgumentException("amount exceeds limit");
          }
          return "{\"charged\":true}";
        })
        .build()) {
      BatchSummary summary = worker.runOnce();
      System.out.println("B processed:     " + summary);
    }
    System.out.println("After drain:     " + instanceB.status("orders"));

    // 7. A late outcome from the crashed instance is ignored
    FailureOutcome late = instanceA.fail(lost.get(0).id(), "timed out");
    System.out.println("Late fail from A: " + late);

    // 8. Operator inspects and replays failures
    for (QueueItem failed : instanceB.failedItems().list("orders", 10)) {
      System.out.println("Failed item " + failed.id() + ": " + failed.error());
    }
    int replayed = instanceB.failedItems().replayAll("orders", 10);
    System.out.println("Replayed " + replayed + " failed items");
    System.out.println("After replay:    " + instanceB.status("orders"));

    System.out.println("Health: " + instanceB.healthCheck().status());
    instanceA.close();
    instanceB.close();
  }

  private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
    String ddl;
    try (InputStream is = WorkQueueDemo.class.getResourceAsStream("/schema/h2.sql")) {
      if (is == null) throw new IOException("Resource not found: /schema/h2.sql");
      ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : ddl.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    }
  }

  private WorkQueueDemo() {}
}
