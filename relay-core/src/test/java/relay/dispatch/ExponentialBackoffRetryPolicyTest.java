package relay.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void doublesPerAttemptWithoutJitter() {
    // 0.5 maps to a jitter factor of exactly 1.0
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000, () -> 0.5);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(400, policy.computeDelayMs(3));
    assertEquals(1600, policy.computeDelayMs(5));
  }

  @Test
  void jitterScalesBetweenHalfAndOneAndAHalf() {
    ExponentialBackoffRetryPolicy low = new ExponentialBackoffRetryPolicy(1000, 60_000, () -> 0.0);
    ExponentialBackoffRetryPolicy high = new ExponentialBackoffRetryPolicy(1000, 60_000, () -> 0.75);

    assertEquals(500, low.computeDelayMs(1));
    assertEquals(1250, high.computeDelayMs(1));
  }

  @Test
  void randomJitterStaysInRange() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 60_000);

    for (int i = 0; i < 100; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 500 && delay < 1500, "got: " + delay);
    }
  }

  @Test
  void neverExceedsMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 5000, () -> 0.999);

    for (int attempt = 1; attempt < 200; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay > 0 && delay <= 5000, "attempt " + attempt + ": " + delay);
    }
    assertEquals(5000, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void baseAboveMaxIsCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(10_000, 3000, () -> 0.5);

    assertEquals(3000, policy.computeDelayMs(1));
  }

  @Test
  void zeroBaseDelayReturnsZero() {
    assertEquals(0L, new ExponentialBackoffRetryPolicy(0, 1000).computeDelayMs(4));
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1, -10));
    assertThrows(NullPointerException.class, () -> new ExponentialBackoffRetryPolicy(1, 10, null));
  }
}
