package workqueue.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 10000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 500 && delay < 1500, "Expected delay between 500-1500, got: " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay2 = policy.computeDelayMs(2);
    long delay3 = policy.computeDelayMs(3);

    assertTrue(delay2 >= 100 && delay2 < 300, "delay2 range: got " + delay2);
    assertTrue(delay3 >= 200 && delay3 < 600, "delay3 range: got " + delay3);
  }

  @Test
  void delayIsCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 10000);

    for (int attempt = 5; attempt < 80; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay <= 10000, "attempt " + attempt + " gave " + delay);
      assertTrue(delay >= 5000, "attempt " + attempt + " gave " + delay);
    }
  }

  @Test
  void nonPositiveAttemptsMeanNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 10000);

    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-3));
  }

  @Test
  void invalidArgumentsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
  }
}
