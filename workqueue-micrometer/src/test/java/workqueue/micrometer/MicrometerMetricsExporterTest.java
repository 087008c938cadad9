package workqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void batchCountersAddTheirCount() {
    exporter.incrementEnqueued(20);
    exporter.incrementEnqueued(5);
    exporter.incrementClaimed(10);
    exporter.incrementReclaimed(3);

    assertEquals(25.0, counter("workqueue.items.enqueued").count());
    assertEquals(10.0, counter("workqueue.items.claimed").count());
    assertEquals(3.0, counter("workqueue.items.reclaimed").count());
  }

  @Test
  void outcomeCounters() {
    exporter.incrementCompleted();
    exporter.incrementCompleted();
    exporter.incrementRequeued();
    exporter.incrementFailed();
    exporter.incrementOwnershipConflicts();
    exporter.incrementStoreErrors();

    assertEquals(2.0, counter("workqueue.items.completed").count());
    assertEquals(1.0, counter("workqueue.items.requeued").count());
    assertEquals(1.0, counter("workqueue.items.failed").count());
    assertEquals(1.0, counter("workqueue.ownership.conflicts").count());
    assertEquals(1.0, counter("workqueue.store.errors").count());
  }

  @Test
  void pendingDepthIsTrackedPerCategory() {
    exporter.recordPendingDepth("orders", 42);
    exporter.recordPendingDepth("emails", 7);
    exporter.recordPendingDepth("orders", 40);

    assertEquals(40.0, depth("orders").value());
    assertEquals(7.0, depth("emails").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "billing.queue");

    prefixed.incrementCompleted();

    assertEquals(1.0, custom.get("billing.queue.items.completed").counter().count());
    assertNull(custom.find("workqueue.items.completed").counter());
  }

  @Test
  void invalidPrefixIsRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "queue."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.recordPendingDepth("orders", 3);
    exporter.incrementCompleted();

    exporter.close();
    exporter.incrementCompleted();
    exporter.recordPendingDepth("emails", 1);

    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge depth(String category) {
    return registry.get("workqueue.pending.depth").tag("category", category).gauge();
  }
}
