package relay.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.cache.AuthorizationCache;
import relay.dispatch.BatchDispatcher;
import relay.model.ChannelEvent;
import relay.resolve.SourceResolver;
import relay.testing.CountingMetrics;
import relay.testing.FakeSourceClient;
import relay.testing.InMemorySourceStore;
import relay.testing.RecordingSink;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static relay.testing.StubConnections.stubCp;

class FilteringIngestListenerTest {

    private InMemorySourceStore store;
    private RecordingSink sink;
    private CountingMetrics metrics;
    private AuthorizationCache cache;
    private BatchDispatcher dispatcher;
    private FilteringIngestListener listener;

    @BeforeEach
    void setUp() {
        store = new InMemorySourceStore();
        store.add("https://t.me/news", 100L, "news");
        sink = new RecordingSink();
        metrics = new CountingMetrics();
        cache = AuthorizationCache.builder()
                .connectionProvider(stubCp())
                .sourceStore(store)
                .resolver(new SourceResolver(stubCp(), store, new FakeSourceClient()))
                .build();
        dispatcher = BatchDispatcher.builder()
                .sink(sink)
                .quietPeriod(Duration.ofMillis(50))
                .build();
        listener = new FilteringIngestListener(cache, dispatcher, metrics);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        cache.close();
    }

    private static ChannelEvent event(long id) {
        return ChannelEvent.builder(id, Instant.now()).message("post " + id).build();
    }

    @Test
    void activeSourceEventsReachTheSink() throws Exception {
        listener.onMessage(100L, event(1), "news");
        listener.onMessage(100L, event(2), "news");

        assertTrue(sink.awaitDeliveries(1, 2, TimeUnit.SECONDS));
        assertEquals(List.of(1L, 2L), sink.deliveries.get(0).ids());
        assertEquals("news", sink.deliveries.get(0).target().channelUsername());
        assertEquals(2, metrics.ingestAccepted.get());
    }

    @Test
    void inactiveSourceEventsAreDropped() throws Exception {
        listener.onMessage(999L, event(1), "stranger");

        assertEquals(0, dispatcher.pendingCount(999L));
        Thread.sleep(200);
        assertTrue(sink.deliveries.isEmpty());
        assertEquals(1, metrics.ingestDropped.get());
    }

    @Test
    void failuresAreContained() {
        assertDoesNotThrow(() -> listener.onMessage(100L, null, "news"));
        assertEquals(1, metrics.ingestErrors.get());
        assertEquals(0, metrics.ingestAccepted.get());
    }

    @Test
    void constructorRejectsNulls() {
        assertThrows(NullPointerException.class, () -> new FilteringIngestListener(null, dispatcher));
        assertThrows(NullPointerException.class, () -> new FilteringIngestListener(cache, null));
    }
}
