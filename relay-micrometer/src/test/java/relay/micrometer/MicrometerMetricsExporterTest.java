package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void ingestCounters() {
    exporter.incrementIngestAccepted();
    exporter.incrementIngestAccepted();
    exporter.incrementIngestDropped();
    exporter.incrementIngestErrors();

    assertEquals(2.0, counter("relay.ingest.accepted").count());
    assertEquals(1.0, counter("relay.ingest.dropped").count());
    assertEquals(1.0, counter("relay.ingest.errors").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementBatchFlushed();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    exporter.incrementDeliveryFailure();

    assertEquals(1.0, counter("relay.batch.flushed").count());
    assertEquals(1.0, counter("relay.delivery.success").count());
    assertEquals(2.0, counter("relay.delivery.failure").count());
  }

  @Test
  void catchUpEventsAddsCount() {
    exporter.incrementCatchUpEvents(50);
    exporter.incrementCatchUpEvents(20);
    exporter.incrementCatchUpEvents(0);
    exporter.incrementCatchUpRetry();

    assertEquals(70.0, counter("relay.catchup.events").count());
    assertEquals(1.0, counter("relay.catchup.retry").count());
  }

  @Test
  void cacheCounters() {
    exporter.incrementCacheRefresh();
    exporter.incrementCacheRefreshFailure();

    assertEquals(1.0, counter("relay.cache.refresh").count());
    assertEquals(1.0, counter("relay.cache.refresh.failure").count());
  }

  @Test
  void gaugesTrackLatestValue() {
    exporter.recordPendingEvents(12);
    exporter.recordCachedSources(3);
    assertEquals(12.0, gauge("relay.pending.events").value());
    assertEquals(3.0, gauge("relay.cache.sources").value());

    exporter.recordPendingEvents(0);
    assertEquals(0.0, gauge("relay.pending.events").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "news.relay");
    custom.incrementIngestAccepted();
    custom.recordPendingEvents(4);

    assertEquals(1.0, counter("news.relay.ingest.accepted").count());
    assertEquals(4.0, gauge("news.relay.pending.events").value());
    assertEquals(0.0, counter("relay.ingest.accepted").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementIngestAccepted();
    exporter.close();

    assertNull(registry.find("relay.ingest.accepted").counter());
    assertNull(registry.find("relay.pending.events").gauge());
    assertDoesNotThrow(() -> exporter.incrementIngestAccepted());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "relay."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
