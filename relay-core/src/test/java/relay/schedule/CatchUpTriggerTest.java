package relay.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.cache.AuthorizationCache;
import relay.model.ChannelEvent;
import relay.reconcile.CatchUpReconciler;
import relay.reconcile.GraceRetry;
import relay.resolve.SourceResolver;
import relay.spi.ConnectionProvider;
import relay.spi.ScheduleParser;
import relay.testing.FakeSourceClient;
import relay.testing.InMemorySourceStore;
import relay.testing.InMemoryWatermarkStore;
import relay.testing.RecordingSink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static relay.testing.StubConnections.failingCp;
import static relay.testing.StubConnections.stubCp;

class CatchUpTriggerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    /** Accepts "every Ns"; anything else is malformed. */
    private static final ScheduleParser EVERY = expression -> {
        if (!expression.matches("every \\d+s")) {
            throw new IllegalArgumentException("bad expression: " + expression);
        }
        long seconds = Long.parseLong(expression.replaceAll("\\D", ""));
        return after -> seconds == 0 ? Optional.empty() : Optional.of(after.plusSeconds(seconds));
    };

    private InMemorySourceStore store;
    private FakeSourceClient client;
    private RecordingSink sink;
    private AuthorizationCache cache;
    private CatchUpReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemorySourceStore();
        store.add("https://t.me/news", 100L, "news");
        client = new FakeSourceClient().channel("news", 100L);
        client.post(100L, ChannelEvent.builder(1L, Instant.now().minusSeconds(30)).message("hello").build());
        sink = new RecordingSink();
        cache = AuthorizationCache.builder()
                .connectionProvider(stubCp())
                .sourceStore(store)
                .resolver(new SourceResolver(stubCp(), store, client))
                .build();
        reconciler = CatchUpReconciler.builder()
                .connectionProvider(stubCp())
                .sourceStore(store)
                .watermarkStore(new InMemoryWatermarkStore())
                .sourceClient(client)
                .sink(sink)
                .graceRetry(new GraceRetry())
                .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private CatchUpTrigger.Builder trigger(ConnectionProvider registry) {
        return CatchUpTrigger.builder()
                .cache(cache)
                .reconciler(reconciler)
                .registry(registry, store)
                .parser(EVERY)
                .defaultExpression("every 600s")
                .initialDelay(null)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingParser() {
        assertThrows(NullPointerException.class, () -> trigger(stubCp()).parser(null).build());
    }

    @Test
    void builderRejectsZeroRecheckInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                trigger(stubCp()).recheckInterval(Duration.ZERO).build());
    }

    @Test
    void builderRejectsNegativeInitialDelay() {
        assertThrows(IllegalArgumentException.class, () ->
                trigger(stubCp()).initialDelay(Duration.ofSeconds(-1)).build());
    }

    // ── Expression selection ────────────────────────────────────────

    @Test
    void defaultExpressionWithoutOverride() {
        assertEquals("every 600s", trigger(stubCp()).build().currentExpression());
    }

    @Test
    void registryOverrideWins() {
        store.schedule = "  every 30s ";
        assertEquals("every 30s", trigger(stubCp()).build().currentExpression());
    }

    @Test
    void blankOverrideFallsBackToDefault() {
        store.schedule = "   ";
        assertEquals("every 600s", trigger(stubCp()).build().currentExpression());
    }

    @Test
    void registryFailureFallsBackToDefault() {
        assertEquals("every 600s", trigger(failingCp()).build().currentExpression());
    }

    // ── Next fire time ──────────────────────────────────────────────

    @Test
    void delayComesFromParsedSchedule() {
        store.schedule = "every 90s";
        assertEquals(Optional.of(Duration.ofSeconds(90)), trigger(stubCp()).build().nextDelay());
    }

    @Test
    void malformedExpressionSkipsCycle() {
        store.schedule = "*/5 * * *";
        assertTrue(trigger(stubCp()).build().nextDelay().isEmpty());
    }

    @Test
    void exhaustedScheduleSkipsCycle() {
        store.schedule = "every 0s";
        assertTrue(trigger(stubCp()).build().nextDelay().isEmpty());
    }

    // ── Running ─────────────────────────────────────────────────────

    @Test
    void runOnceRefreshesCacheAndCatchesUp() {
        CatchUpTrigger trigger = trigger(stubCp()).build();

        trigger.runOnce();

        assertEquals(1, sink.deliveries.size());
        assertTrue(cache.find(100L).isPresent());
    }

    @Test
    void runOnceSwallowsFailures() {
        store.failReads = true;
        trigger(stubCp()).build().runOnce();
        assertTrue(sink.deliveries.isEmpty());
    }

    @Test
    void startRunsInitialCatchUpAfterDelay() throws Exception {
        try (CatchUpTrigger trigger = trigger(stubCp()).initialDelay(Duration.ofMillis(50)).build()) {
            trigger.start();
            trigger.start();
            assertTrue(sink.awaitDeliveries(1, 5, TimeUnit.SECONDS));
        }
    }

    @Test
    void startAfterCloseFails() {
        CatchUpTrigger trigger = trigger(stubCp()).build();
        trigger.close();
        assertThrows(IllegalStateException.class, trigger::start);
    }
}
