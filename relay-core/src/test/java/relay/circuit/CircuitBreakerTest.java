package relay.circuit;

import org.junit.jupiter.api.Test;
import relay.MutableClock;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

  private final MutableClock clock = new MutableClock();

  private CircuitBreaker breaker(int threshold) {
    return new CircuitBreaker(threshold, Duration.ofSeconds(60), clock);
  }

  @Test
  void startsClosed() {
    CircuitBreaker breaker = breaker(5);

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(CircuitBreakerState.INITIAL, breaker.snapshot());
    assertTrue(breaker.canAttempt());
  }

  @Test
  void opensWhenFailuresReachThreshold() {
    CircuitBreaker breaker = breaker(3);

    breaker.recordFailure();
    breaker.recordFailure();
    assertEquals(CircuitState.CLOSED, breaker.state());

    breaker.recordFailure();

    CircuitBreakerState snapshot = breaker.snapshot();
    assertEquals(CircuitState.OPEN, snapshot.state());
    assertEquals(3, snapshot.consecutiveFailures());
    assertEquals(clock.instant(), snapshot.openedAt());
    assertFalse(breaker.canAttempt());
  }

  @Test
  void successResetsConsecutiveFailures() {
    CircuitBreaker breaker = breaker(3);
    breaker.recordFailure();
    breaker.recordFailure();

    breaker.recordSuccess();
    breaker.recordFailure();
    breaker.recordFailure();

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(2, breaker.snapshot().consecutiveFailures());
  }

  @Test
  void staysOpenUntilCooldownElapses() {
    CircuitBreaker breaker = breaker(1);
    breaker.recordFailure();

    clock.advance(Duration.ofSeconds(59));

    assertFalse(breaker.canAttempt());
    assertEquals(CircuitState.OPEN, breaker.state());
  }

  @Test
  void halfOpenAfterCooldownAdmitsSingleTrial() {
    CircuitBreaker breaker = breaker(1);
    breaker.recordFailure();
    clock.advance(Duration.ofSeconds(60));

    assertTrue(breaker.canAttempt());
    assertEquals(CircuitState.HALF_OPEN, breaker.state());
    assertFalse(breaker.canAttempt(), "second caller must wait for the trial");
  }

  @Test
  void trialSuccessCloses() {
    CircuitBreaker breaker = breaker(1);
    breaker.recordFailure();
    clock.advance(Duration.ofSeconds(60));
    breaker.canAttempt();

    breaker.recordSuccess();

    CircuitBreakerState snapshot = breaker.snapshot();
    assertEquals(CircuitState.CLOSED, snapshot.state());
    assertEquals(0, snapshot.consecutiveFailures());
    assertNull(snapshot.openedAt());
  }

  @Test
  void trialFailureReopensAndRestampsOpenedAt() {
    CircuitBreaker breaker = breaker(5);
    for (int i = 0; i < 5; i++) {
      breaker.recordFailure();
    }
    clock.advance(Duration.ofSeconds(61));
    breaker.canAttempt();

    breaker.recordFailure();

    CircuitBreakerState snapshot = breaker.snapshot();
    assertEquals(CircuitState.OPEN, snapshot.state());
    assertEquals(clock.instant(), snapshot.openedAt());
    assertFalse(breaker.canAttempt());
  }

  @Test
  void releasedTrialCanBeTakenAgain() {
    CircuitBreaker breaker = breaker(1);
    breaker.recordFailure();
    clock.advance(Duration.ofSeconds(60));
    assertTrue(breaker.canAttempt());

    breaker.releaseTrial();

    assertTrue(breaker.canAttempt());
    assertEquals(CircuitState.HALF_OPEN, breaker.state());
  }

  @Test
  void resetReturnsToClosed() {
    CircuitBreaker breaker = breaker(1);
    breaker.recordFailure();

    breaker.reset();

    assertEquals(CircuitBreakerState.INITIAL, breaker.snapshot());
    assertTrue(breaker.canAttempt());
  }

  @Test
  void constructorRejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> new CircuitBreaker(0, Duration.ofSeconds(1), clock));
    assertThrows(IllegalArgumentException.class,
        () -> new CircuitBreaker(1, Duration.ofSeconds(-1), clock));
    assertThrows(NullPointerException.class,
        () -> new CircuitBreaker(1, null, clock));
    assertThrows(NullPointerException.class,
        () -> new CircuitBreaker(1, Duration.ZERO, null));
  }
}
