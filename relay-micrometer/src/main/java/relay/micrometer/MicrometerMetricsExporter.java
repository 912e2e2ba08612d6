package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.ingest.accepted}: events handed to the dispatcher</li>
 *   <li>{@code relay.ingest.dropped}: events from inactive sources</li>
 *   <li>{@code relay.ingest.errors}: events whose handling threw</li>
 *   <li>{@code relay.batch.flushed}: batches popped for delivery</li>
 *   <li>{@code relay.delivery.success}: batches accepted by the sink</li>
 *   <li>{@code relay.delivery.failure}: batches rejected or lost to an exception</li>
 *   <li>{@code relay.catchup.events}: events fetched by catch-up runs</li>
 *   <li>{@code relay.catchup.retry}: grace-period retries</li>
 *   <li>{@code relay.cache.refresh}: completed cache refreshes</li>
 *   <li>{@code relay.cache.refresh.failure}: refreshes aborted by a registry failure</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.pending.events}: events buffered across all sources</li>
 *   <li>{@code relay.cache.sources}: sources in the current authorization snapshot</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final List<Meter> meters = new ArrayList<>();

  private final Counter ingestAccepted;
  private final Counter ingestDropped;
  private final Counter ingestErrors;
  private final Counter batchFlushed;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter catchUpEvents;
  private final Counter catchUpRetry;
  private final Counter cacheRefresh;
  private final Counter cacheRefreshFailure;

  private final AtomicInteger pendingEvents = new AtomicInteger();
  private final AtomicInteger cachedSources = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several relays in one
   * registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;

    this.ingestAccepted = counter("ingest.accepted", "Events handed to the dispatcher");
    this.ingestDropped = counter("ingest.dropped", "Events dropped because their source is inactive");
    this.ingestErrors = counter("ingest.errors", "Events whose handling threw");
    this.batchFlushed = counter("batch.flushed", "Batches popped for delivery");
    this.deliverySuccess = counter("delivery.success", "Batches accepted by the sink");
    this.deliveryFailure = counter("delivery.failure", "Batches rejected by the sink or lost to an exception");
    this.catchUpEvents = counter("catchup.events", "Events fetched by catch-up runs");
    this.catchUpRetry = counter("catchup.retry", "Grace-period retries taken by the reconciler");
    this.cacheRefresh = counter("cache.refresh", "Completed authorization cache refreshes");
    this.cacheRefreshFailure = counter("cache.refresh.failure", "Cache refreshes aborted by a registry failure");

    meters.add(Gauge.builder(namePrefix + ".pending.events", pendingEvents, AtomicInteger::get)
        .description("Events buffered across all sources")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".cache.sources", cachedSources, AtomicInteger::get)
        .description("Sources in the current authorization snapshot")
        .register(registry));
  }

  private Counter counter(String suffix, String description) {
    Counter counter = Counter.builder(namePrefix + "." + suffix)
        .description(description)
        .register(registry);
    meters.add(counter);
    return counter;
  }

  @Override
  public void incrementIngestAccepted() {
    if (closed) return;
    ingestAccepted.increment();
  }

  @Override
  public void incrementIngestDropped() {
    if (closed) return;
    ingestDropped.increment();
  }

  @Override
  public void incrementIngestErrors() {
    if (closed) return;
    ingestErrors.increment();
  }

  @Override
  public void incrementBatchFlushed() {
    if (closed) return;
    batchFlushed.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementCatchUpEvents(int count) {
    if (closed || count <= 0) return;
    catchUpEvents.increment(count);
  }

  @Override
  public void incrementCatchUpRetry() {
    if (closed) return;
    catchUpRetry.increment();
  }

  @Override
  public void incrementCacheRefresh() {
    if (closed) return;
    cacheRefresh.increment();
  }

  @Override
  public void incrementCacheRefreshFailure() {
    if (closed) return;
    cacheRefreshFailure.increment();
  }

  @Override
  public void recordPendingEvents(int pending) {
    if (closed) return;
    pendingEvents.set(pending);
  }

  @Override
  public void recordCachedSources(int sources) {
    if (closed) return;
    cachedSources.set(sources);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link relay.Relay} is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
