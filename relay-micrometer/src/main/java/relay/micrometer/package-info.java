/**
 * Micrometer bridge for exporting relay metrics.
 *
 * <p>{@link relay.micrometer.MicrometerMetricsExporter} implements the
 * {@link relay.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package relay.micrometer;
