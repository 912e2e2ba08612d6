/**
 * Root API of the relay: a framework-free engine that forwards channel messages to an HTTP
 * sink in deduplicated, chronologically ordered batches.
 *
 * <h2>Core Design</h2>
 * <p>Two paths feed the same {@linkplain relay.spi.DeliverySink sink}. The real-time path
 * receives messages through an {@link relay.spi.IngestListener}, filters them against the
 * {@linkplain relay.cache.AuthorizationCache authorization cache} and batches them per
 * source in the {@linkplain relay.dispatch.BatchDispatcher dispatcher} (1 s quiet period,
 * 5 s max wait). The catch-up path is driven by a cron
 * {@linkplain relay.schedule.CatchUpTrigger trigger}: the
 * {@linkplain relay.reconcile.CatchUpReconciler reconciler} fetches history newer than each
 * source's {@linkplain relay.model.Watermark watermark}, bounded to the last hour, and
 * delivers it oldest first in chunks of 50.
 *
 * <p>Both paths advance the same watermark with a max-merge, so running them concurrently
 * never moves a cursor backwards. Delivery is at-least-once.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>relay-core</b>: model, SPI, cache, dispatcher, reconciler, trigger</li>
 *   <li><b>relay-jdbc</b>: registry and watermark stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>relay-http</b>: JSON-over-HTTP delivery sink</li>
 *   <li><b>relay-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>relay-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * @see relay.Relay
 * @see relay.DeliveryResult
 */
package relay;
