package workqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import workqueue.WorkQueue;
import workqueue.jdbc.store.H2QueueStore;
import workqueue.model.ClaimedItem;
import workqueue.model.QueueStatus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Several facades claiming from one category through a shared pool.
 */
class HikariConcurrencyTest {
  private HikariDataSource hikariDs;
  private DataSourceConnectionProvider connectionProvider;
  private final H2QueueStore store = new H2QueueStore();

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(Schemas.h2Url());
    config.setMaximumPoolSize(8);
    config.setMinimumIdle(1);
    config.setPoolName("workqueue-test-pool");

    hikariDs = new HikariDataSource(config);
    Schemas.create(hikariDs, "/schema/h2.sql");
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  private WorkQueue queue(String instanceId) {
    return WorkQueue.builder()
        .connectionProvider(connectionProvider)
        .queueStore(store)
        .instanceId(instanceId)
        .build();
  }

  private static List<String> payloads(int count) {
    return IntStream.rangeClosed(1, count).mapToObj(i -> "{\"n\":" + i + "}").toList();
  }

  @Test
  void threeClaimersTakeEveryRowExactlyOnce() throws Exception {
    queue("seed").enqueue("orders", payloads(15));

    List<List<Long>> claims = runClaimers(3, 5, "orders");

    assertDisjointAndComplete(claims, 15);
    assertEquals(new QueueStatus(0, 15, 0, 0), queue("check").status("orders"));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void manyClaimersWithSmallBatchesNeverShareRows() throws Exception {
    queue("seed").enqueue("orders", payloads(200));

    List<List<Long>> claims = runClaimers(6, 7, "orders");

    assertDisjointAndComplete(claims, 200);
  }

  @Test
  void claimersCompleteEverythingAfterRecovery() throws Exception {
    WorkQueue crashed = queue("crashed");
    crashed.enqueue("orders", payloads(30));
    crashed.claim("orders", 12);
    assertEquals(12, queue("janitor").reclaimOrphans(Duration.ZERO));

    ExecutorService pool = Executors.newFixedThreadPool(3);
    try {
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 3; i++) {
        WorkQueue worker = queue("worker-" + i);
        futures.add(pool.submit(() -> {
          int done = 0;
          List<ClaimedItem> batch;
          while (!(batch = worker.claim("orders", 4)).isEmpty() || !drained(worker)) {
            for (ClaimedItem item : batch) {
              if (worker.complete(item.id(), "{}")) {
                done++;
              }
            }
          }
          return done;
        }));
      }
      int total = 0;
      for (Future<Integer> f : futures) {
        total += f.get(30, TimeUnit.SECONDS);
      }
      assertEquals(30, total);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(new QueueStatus(0, 0, 30, 0), queue("check").status("orders"));
  }

  private static boolean drained(WorkQueue queue) {
    return queue.status("orders").pending() == 0;
  }

  /** Each claimer loops until the category has nothing pending left. */
  private List<List<Long>> runClaimers(int threads, int batchSize, String category) throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<List<Long>>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        WorkQueue queue = queue("claimer-" + i);
        Callable<List<Long>> claimer = () -> {
          start.await();
          List<Long> ids = new ArrayList<>();
          while (true) {
            List<ClaimedItem> batch = queue.claim(category, batchSize);
            if (batch.isEmpty()) {
              if (queue.status(category).pending() == 0) {
                return ids;
              }
              continue;
            }
            assertTrue(batch.size() <= batchSize);
            batch.forEach(item -> ids.add(item.id()));
          }
        };
        futures.add(pool.submit(claimer));
      }
      start.countDown();
      List<List<Long>> results = new ArrayList<>();
      for (Future<List<Long>> f : futures) {
        results.add(f.get(30, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      pool.shutdownNow();
    }
  }

  private static void assertDisjointAndComplete(List<List<Long>> claims, int expected) {
    Set<Long> seen = ConcurrentHashMap.newKeySet();
    int total = 0;
    for (List<Long> ids : claims) {
      for (Long id : ids) {
        assertTrue(seen.add(id), "row " + id + " claimed twice");
        total++;
      }
    }
    assertEquals(expected, total);
    assertEquals(expected, seen.size());
  }
}
