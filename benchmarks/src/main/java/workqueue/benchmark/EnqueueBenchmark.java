package workqueue.benchmark;

import org.openjdk.jmh.annotations.*;
import workqueue.WorkQueue;
import workqueue.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import workqueue.jdbc.DataSourceConnectionProvider;

import javax.sql.DataSource;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures {@link WorkQueue#enqueue} throughput (ops/sec), one transaction per call.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EnqueueBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql EnqueueBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class EnqueueBenchmark {

  private DataSource dataSource;
  private WorkQueue workQueue;
  private List<String> payloads;

  @Param({"h2"})
  private String database;

  @Param({"1", "100"})
  private int batchSize;

  @Param({"100", "1000"})
  private int payloadSize;

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_enqueue");
    BenchmarkDataSourceFactory.truncate(db.dataSource());

    dataSource = db.dataSource();
    workQueue = WorkQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueStore(db.store())
        .instanceId("bench-enqueue")
        .build();
    String payload = "{\"data\":\"" + "x".repeat(Math.max(0, payloadSize - 11)) + "\"}";
    payloads = Collections.nCopies(batchSize, payload);
  }

  @Benchmark
  public int enqueue() {
    return workQueue.enqueue("bench", payloads);
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    workQueue.close();
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }
}
