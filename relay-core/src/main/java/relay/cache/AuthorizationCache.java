package relay.cache;

import relay.model.Source;
import relay.resolve.SourceResolver;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.SourceStore;
import relay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Point-in-time view of the sources with an active delivery subscription, keyed by
 * external id.
 *
 * <p>The view is an immutable {@link Snapshot} held in an {@link AtomicReference}; readers
 * never lock. A refresh builds a complete new map and swaps it in with a single write.
 *
 * <p>Refreshes are single-flight: they run under one lock and re-check staleness after
 * acquiring it, so callers that queued behind a running refresh return without touching the
 * registry. Unresolved sources are resolved concurrently on a small pool; a failure excludes
 * only the failing source. A registry read failure keeps the previous snapshot and its
 * timestamp, so the next caller retries.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class AuthorizationCache implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(AuthorizationCache.class.getName());

    private final ConnectionProvider connectionProvider;
    private final SourceStore sourceStore;
    private final SourceResolver resolver;
    private final Duration ttl;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final ExecutorService resolverPool;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    private AuthorizationCache(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.sourceStore = Objects.requireNonNull(builder.sourceStore, "sourceStore");
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver");
        this.ttl = Objects.requireNonNull(builder.ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        if (builder.resolverThreads <= 0) {
            throw new IllegalArgumentException("resolverThreads must be > 0");
        }
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.resolverPool = Executors.newFixedThreadPool(builder.resolverThreads,
                new DaemonThreadFactory("relay-resolver-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the external ids of all active sources, refreshing first when the snapshot is
     * older than the TTL.
     *
     * @return an unmodifiable set of external ids
     */
    public Set<Long> activeSourceIds() {
        if (isStale(snapshot.get())) {
            refresh();
        }
        return snapshot.get().sources().keySet();
    }

    /**
     * Looks up an active source by external id in the current snapshot, without refreshing.
     */
    public Optional<Source> find(long externalId) {
        return Optional.ofNullable(snapshot.get().sources().get(externalId));
    }

    /**
     * Returns the current snapshot.
     */
    public Snapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Marks the snapshot stale so the next read triggers a refresh.
     */
    public void invalidate() {
        snapshot.updateAndGet(current -> new Snapshot(current.sources(), Instant.EPOCH));
    }

    /**
     * Rebuilds the snapshot from the source registry if it is stale.
     *
     * @return {@code true} if this call installed a new snapshot, {@code false} if the
     *         snapshot was already fresh or the registry could not be read
     */
    public boolean refresh() {
        refreshLock.lock();
        try {
            if (!isStale(snapshot.get())) {
                return false;
            }

            List<Source> sources = loadActiveSources();
            if (sources == null) {
                return false;
            }

            Map<Long, Source> resolved = resolveAll(sources);
            snapshot.set(new Snapshot(Collections.unmodifiableMap(resolved), clock.instant()));
            metrics.incrementCacheRefresh();
            metrics.recordCachedSources(resolved.size());
            logger.log(Level.INFO, "Refreshed active sources cache: {0} sources", resolved.size());
            return true;
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isStale(Snapshot current) {
        return Duration.between(current.refreshedAt(), clock.instant()).compareTo(ttl) > 0;
    }

    /**
     * Returns {@code null} on failure (to distinguish from a successful empty result).
     */
    private List<Source> loadActiveSources() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return sourceStore.listActiveSubscribed(conn);
        } catch (SQLException | RuntimeException e) {
            metrics.incrementCacheRefreshFailure();
            logger.log(Level.SEVERE, "Failed to load active sources; keeping previous cache", e);
            return null;
        }
    }

    private Map<Long, Source> resolveAll(List<Source> sources) {
        List<CompletableFuture<Source>> tasks = new ArrayList<>(sources.size());
        for (Source source : sources) {
            if (source.isResolved()) {
                tasks.add(CompletableFuture.completedFuture(source));
            } else {
                tasks.add(CompletableFuture
                        .supplyAsync(() -> resolver.resolve(source), resolverPool)
                        .handle((result, failure) -> {
                            if (failure != null) {
                                Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
                                logger.log(Level.WARNING, "Excluding source " + source.id()
                                        + " (" + source.url() + ") from cache: " + cause.getMessage(), cause);
                                return null;
                            }
                            return result;
                        }));
            }
        }

        Map<Long, Source> byExternalId = new LinkedHashMap<>();
        for (CompletableFuture<Source> task : tasks) {
            Source source = task.join();
            if (source != null && source.isResolved()) {
                byExternalId.put(source.externalId(), source);
            }
        }
        return byExternalId;
    }

    /**
     * Shuts down the resolver pool.
     */
    @Override
    public void close() {
        resolverPool.shutdownNow();
        try {
            resolverPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Immutable cache contents.
     *
     * @param sources     active sources keyed by external id
     * @param refreshedAt time of the refresh that produced this snapshot
     */
    public record Snapshot(Map<Long, Source> sources, Instant refreshedAt) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Instant.EPOCH);
    }

    /**
     * Builder for {@link AuthorizationCache}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private SourceStore sourceStore;
        private SourceResolver resolver;
        private Duration ttl = Duration.ofSeconds(30);
        private Clock clock;
        private MetricsExporter metrics;
        private int resolverThreads = 4;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder sourceStore(SourceStore sourceStore) {
            this.sourceStore = sourceStore;
            return this;
        }

        /**
         * Sets the resolver used for sources without an external id.
         *
         * <p><b>Required.</b>
         */
        public Builder resolver(SourceResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Sets how long a snapshot stays fresh.
         *
         * <p>Optional. Defaults to 30 seconds.
         */
        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the number of threads resolving sources concurrently.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
         */
        public Builder resolverThreads(int resolverThreads) {
            this.resolverThreads = resolverThreads;
            return this;
        }

        /**
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if {@code ttl} is negative or
         *                                  {@code resolverThreads <= 0}
         */
        public AuthorizationCache build() {
            return new AuthorizationCache(this);
        }
    }
}
