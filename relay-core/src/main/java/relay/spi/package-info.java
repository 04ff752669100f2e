/**
 * Service Provider Interfaces (SPI) for extending the relay.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in the remote store and a metrics backend.
 *
 * @see relay.spi.Sink
 * @see relay.spi.MetricsExporter
 */
package relay.spi;
