package relay.circuit;

/**
 * States of the {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Normal operation; sends are attempted. */
  CLOSED,
  /** Sends are suppressed until the cool-down elapses. */
  OPEN,
  /** A single trial send is permitted to probe recovery. */
  HALF_OPEN
}
