package relay.circuit;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time copy of a {@link CircuitBreaker}.
 *
 * @param state               the breaker state
 * @param consecutiveFailures failures since the last success
 * @param openedAt            when the breaker last opened, {@code null} if never
 */
public record CircuitBreakerState(CircuitState state, int consecutiveFailures, Instant openedAt) {

  public static final CircuitBreakerState INITIAL = new CircuitBreakerState(CircuitState.CLOSED, 0, null);

  public CircuitBreakerState {
    Objects.requireNonNull(state, "state");
  }
}
