package workqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void createsSequentiallyNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("workqueue-reclaim-");

    Thread t1 = factory.newThread(() -> {
    });
    Thread t2 = factory.newThread(() -> {
    });

    assertTrue(t1.isDaemon());
    assertEquals("workqueue-reclaim-1", t1.getName());
    assertEquals("workqueue-reclaim-2", t2.getName());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
