package relay.metrics;

import relay.circuit.CircuitBreakerState;

/**
 * Point-in-time copy of the pipeline counters. Never a live view.
 *
 * @param eventsTracked       records delivered to the sink
 * @param eventsDropped       records discarded (circuit open, buffer full, dead-letter eviction)
 * @param eventsFailed        records whose batch exhausted its retries
 * @param batchesSent         batches delivered to the sink
 * @param batchesFailed       batches that exhausted their retries
 * @param rateLimitHits       sink calls rejected as rate-limited
 * @param averageFlushTimeMs  mean duration over the recent flush window, 0 if none
 * @param lastFlushTimeMs     duration of the most recent flush, 0 if none
 * @param circuitBreakerState breaker state when the snapshot was taken
 * @param deadLetterQueueSize entries held in the dead-letter queue
 */
public record MetricsSnapshot(
    long eventsTracked,
    long eventsDropped,
    long eventsFailed,
    long batchesSent,
    long batchesFailed,
    long rateLimitHits,
    double averageFlushTimeMs,
    long lastFlushTimeMs,
    CircuitBreakerState circuitBreakerState,
    int deadLetterQueueSize) {
}
