/**
 * Service Provider Interfaces (SPI) for plugging the subscription core into a store,
 * a network transport and a metrics backend.
 *
 * @see livefeed.spi.ConnectionProvider
 * @see livefeed.spi.NotificationFeed
 * @see livefeed.spi.SessionTransport
 * @see livefeed.spi.MetricsExporter
 */
package livefeed.spi;
