/**
 * Micrometer binding for {@link livefeed.spi.MetricsExporter}.
 */
package livefeed.micrometer;
