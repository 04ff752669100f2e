/**
 * Circuit breaker that suspends sink calls after repeated failures.
 *
 * @see relay.circuit.CircuitBreaker
 */
package relay.circuit;
