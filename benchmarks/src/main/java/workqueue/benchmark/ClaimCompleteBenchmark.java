package workqueue.benchmark;

import org.openjdk.jmh.annotations.*;
import workqueue.WorkQueue;
import workqueue.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import workqueue.jdbc.DataSourceConnectionProvider;
import workqueue.model.ClaimedItem;

import javax.sql.DataSource;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures a full claim-then-complete cycle per batch with several concurrent claimers.
 *
 * <p>The backlog is refilled whenever a claim comes back short, so each measured call
 * claims from a non-empty category.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar ClaimCompleteBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
@Threads(4)
public class ClaimCompleteBenchmark {

  private static final String CATEGORY = "bench";
  private static final int REFILL = 5_000;

  private DataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private DatabaseSetup db;

  @Param({"h2"})
  private String database;

  @Param({"1", "10", "100"})
  private int batchSize;

  @Setup(Level.Trial)
  public void setup() {
    db = BenchmarkDataSourceFactory.create(database, "bench_claim");
    BenchmarkDataSourceFactory.truncate(db.dataSource());
    dataSource = db.dataSource();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
  }

  @State(Scope.Thread)
  public static class Claimer {
    WorkQueue workQueue;
    List<String> refill;

    @Setup(Level.Trial)
    public void setup(ClaimCompleteBenchmark bench) {
      workQueue = WorkQueue.builder()
          .connectionProvider(bench.connectionProvider)
          .queueStore(bench.db.store())
          .build();
      refill = Collections.nCopies(REFILL, "{\"task\":\"bench\"}");
    }

    @TearDown(Level.Trial)
    public void tearDown() {
      workQueue.close();
    }
  }

  @Benchmark
  public int claimAndComplete(Claimer claimer) {
    List<ClaimedItem> items = claimer.workQueue.claim(CATEGORY, batchSize);
    if (items.size() < batchSize) {
      claimer.workQueue.enqueue(CATEGORY, claimer.refill);
    }
    for (ClaimedItem item : items) {
      claimer.workQueue.complete(item.id(), "{}");
    }
    return items.size();
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }
}
