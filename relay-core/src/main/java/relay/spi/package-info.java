/**
 * Service provider interfaces for the relay's external collaborators.
 *
 * <p>Stores receive an explicit {@link java.sql.Connection} from a
 * {@link relay.spi.ConnectionProvider}. The protocol client, delivery sink and schedule
 * parser are plain interfaces so they can be stubbed in tests.
 *
 * @see relay.spi.SourceStore
 * @see relay.spi.WatermarkStore
 * @see relay.spi.DeliverySink
 * @see relay.spi.SourceClient
 * @see relay.spi.MetricsExporter
 */
package relay.spi;
