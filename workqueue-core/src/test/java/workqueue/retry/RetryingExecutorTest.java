package workqueue.retry;

import org.junit.jupiter.api.Test;
import workqueue.ConfigurationException;
import workqueue.QueueUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingExecutorTest {

  private final List<Long> sleeps = new ArrayList<>();
  private final RetryingExecutor executor =
      new RetryingExecutor(attempts -> attempts * 10L, 3, sleeps::add);

  @Test
  void returnsFirstSuccess() {
    assertEquals("ok", executor.execute("op", () -> "ok"));
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void retriesUnavailableUntilSuccess() {
    AtomicInteger calls = new AtomicInteger();

    String result = executor.execute("claim", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new QueueUnavailableException("claim", "down");
      }
      return "done";
    });

    assertEquals("done", result);
    assertEquals(3, calls.get());
    assertEquals(List.of(10L, 20L), sleeps);
  }

  @Test
  void rethrowsLastFailureAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();

    QueueUnavailableException e = assertThrows(QueueUnavailableException.class,
        () -> executor.execute("claim", () -> {
          throw new QueueUnavailableException("claim", "down " + calls.incrementAndGet());
        }));

    assertEquals(3, calls.get());
    assertEquals("down 3", e.getMessage());
    assertEquals(1, e.getSuppressed().length);
    assertEquals(2, sleeps.size());
  }

  @Test
  void otherExceptionsAreNotRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(ConfigurationException.class, () -> executor.execute("op", () -> {
      calls.incrementAndGet();
      throw new ConfigurationException("batchSize", "bad");
    }));
    assertThrows(IllegalStateException.class, () -> executor.execute("op", () -> {
      calls.incrementAndGet();
      throw new IllegalStateException("bug");
    }));

    assertEquals(2, calls.get());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void interruptStopsRetrying() {
    RetryingExecutor interrupted = new RetryingExecutor(attempts -> 5L, 3, millis -> {
      throw new InterruptedException();
    });

    try {
      assertThrows(QueueUnavailableException.class, () -> interrupted.run("op", () -> {
        throw new QueueUnavailableException("op", "down");
      }));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void defaultsMatchDocumentedPolicy() {
    assertEquals(3, new RetryingExecutor().maxAttempts());
    assertThrows(IllegalArgumentException.class, () -> new RetryingExecutor(attempts -> 0L, 0));
  }
}
