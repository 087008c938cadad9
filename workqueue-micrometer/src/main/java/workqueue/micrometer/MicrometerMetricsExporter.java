package workqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import workqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code workqueue.items.enqueued} - rows created by enqueue</li>
 *   <li>{@code workqueue.items.claimed} - rows claimed by this instance</li>
 *   <li>{@code workqueue.items.completed} - rows completed</li>
 *   <li>{@code workqueue.items.requeued} - failed rows put back to pending</li>
 *   <li>{@code workqueue.items.failed} - rows that exhausted their retries</li>
 *   <li>{@code workqueue.items.reclaimed} - orphaned rows returned to pending</li>
 *   <li>{@code workqueue.ownership.conflicts} - outcomes reported for rows no longer owned</li>
 *   <li>{@code workqueue.store.errors} - store operations that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code workqueue.pending.depth} - last observed pending rows, tagged {@code category}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter completed;
  private final Counter requeued;
  private final Counter failed;
  private final Counter reclaimed;
  private final Counter ownershipConflicts;
  private final Counter storeErrors;

  private final Map<String, AtomicLong> pendingDepths = new ConcurrentHashMap<>();
  private final Map<String, Gauge> depthGauges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "workqueue"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "workqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.workqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.enqueued = counter(".items.enqueued", "Rows created by enqueue");
    this.claimed = counter(".items.claimed", "Rows claimed");
    this.completed = counter(".items.completed", "Rows completed");
    this.requeued = counter(".items.requeued", "Failed rows returned to pending");
    this.failed = counter(".items.failed", "Rows that exhausted their retries");
    this.reclaimed = counter(".items.reclaimed", "Orphaned rows returned to pending");
    this.ownershipConflicts = counter(".ownership.conflicts", "Outcomes reported for rows no longer owned");
    this.storeErrors = counter(".store.errors", "Store operations that failed");
  }

  private Counter counter(String suffix, String description) {
    return Counter.builder(namePrefix + suffix)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementEnqueued(int count) {
    if (closed) return;
    enqueued.increment(count);
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed) return;
    claimed.increment(count);
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementRequeued() {
    if (closed) return;
    requeued.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementReclaimed(int count) {
    if (closed) return;
    reclaimed.increment(count);
  }

  @Override
  public void incrementOwnershipConflicts() {
    if (closed) return;
    ownershipConflicts.increment();
  }

  @Override
  public void incrementStoreErrors() {
    if (closed) return;
    storeErrors.increment();
  }

  @Override
  public void recordPendingDepth(String category, long depth) {
    if (closed) return;
    pendingDepths.computeIfAbsent(category, this::registerDepthGauge).set(depth);
  }

  private AtomicLong registerDepthGauge(String category) {
    AtomicLong holder = new AtomicLong();
    Gauge gauge = Gauge.builder(namePrefix + ".pending.depth", holder, AtomicLong::get)
        .description("Last observed pending rows")
        .tag("category", category)
        .register(registry);
    depthGauges.put(category, gauge);
    return holder;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link workqueue.WorkQueue} is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, claimed, completed, requeued,
        failed, reclaimed, ownershipConflicts, storeErrors));
    meters.addAll(depthGauges.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
