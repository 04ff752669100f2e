/**
 * Pipeline counters and flush-time history.
 */
package relay.metrics;
