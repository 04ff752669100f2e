/**
 * Micrometer bridge for relay metrics.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;
