package relay.schedule;

import relay.cache.AuthorizationCache;
import relay.reconcile.CatchUpReconciler;
import relay.spi.ConnectionProvider;
import relay.spi.Schedule;
import relay.spi.ScheduleParser;
import relay.spi.SourceStore;
import relay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cron-driven safety net that periodically refreshes the authorization cache and runs a
 * full catch-up.
 *
 * <p>The schedule is re-read before every cycle: the registry's override wins, otherwise the
 * configured default applies. A malformed expression skips the cycle and logs an error; the
 * trigger looks at the expression again after {@code recheckInterval}. The real-time path
 * is not affected either way.
 *
 * <p>On {@link #start()} an initial catch-up runs after {@code initialDelay}, independent of
 * the cron schedule.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class CatchUpTrigger implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CatchUpTrigger.class.getName());

    private final AuthorizationCache cache;
    private final CatchUpReconciler reconciler;
    private final ConnectionProvider connectionProvider;
    private final SourceStore sourceStore;
    private final ScheduleParser parser;
    private final String defaultExpression;
    private final Duration recheckInterval;
    private final Duration initialDelay;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> nextRun;
    private volatile boolean closed;

    private CatchUpTrigger(Builder builder) {
        this.cache = Objects.requireNonNull(builder.cache, "cache");
        this.reconciler = Objects.requireNonNull(builder.reconciler, "reconciler");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.sourceStore = Objects.requireNonNull(builder.sourceStore, "sourceStore");
        this.parser = Objects.requireNonNull(builder.parser, "parser");
        this.defaultExpression = Objects.requireNonNull(builder.defaultExpression, "defaultExpression");
        this.recheckInterval = Objects.requireNonNull(builder.recheckInterval, "recheckInterval");
        if (recheckInterval.isNegative() || recheckInterval.isZero()) {
            throw new IllegalArgumentException("recheckInterval must be positive");
        }
        this.initialDelay = builder.initialDelay;
        if (initialDelay != null && initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules the initial catch-up and the first cron cycle. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CatchUpTrigger has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-catchup-"));
        if (initialDelay != null) {
            scheduler.schedule(this::runOnce, initialDelay.toMillis(), TimeUnit.MILLISECONDS);
        }
        scheduleNext();
    }

    /**
     * Runs one cycle: cache refresh, then catch-up for every active source. Called by the
     * scheduler, but may also be invoked directly.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        try {
            cache.refresh();
            reconciler.reconcileAll();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Catch-up cycle failed", t);
        }
    }

    /**
     * Returns the expression the next cycle will use: the registry override if present,
     * otherwise the configured default.
     */
    public String currentExpression() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            Optional<String> override = sourceStore.findSchedule(conn);
            if (override.isPresent() && !override.get().isBlank()) {
                return override.get().trim();
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to read schedule from registry; using default " + defaultExpression, e);
        }
        return defaultExpression;
    }

    /**
     * Computes the delay until the next cycle. A malformed or exhausted schedule yields
     * empty; the caller then waits {@code recheckInterval} without running a cycle.
     */
    Optional<Duration> nextDelay() {
        String expression = currentExpression();
        Schedule schedule;
        try {
            schedule = parser.parse(expression);
        } catch (IllegalArgumentException e) {
            logger.log(Level.SEVERE, "Invalid catch-up schedule \"" + expression + "\"; skipping cycle, rechecking in "
                    + recheckInterval, e);
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<Instant> next = schedule.next(now);
        if (next.isEmpty()) {
            logger.log(Level.WARNING, "Catch-up schedule \"{0}\" has no future fire time", expression);
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, next.get()));
    }

    private void scheduleNext() {
        if (closed) {
            return;
        }
        try {
            Optional<Duration> delay = nextDelay();
            Runnable task = delay.isPresent() ? this::fire : this::scheduleNext;
            long delayMs = delay.orElse(recheckInterval).toMillis();
            nextRun = scheduler.schedule(task, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // scheduler shut down by close()
            if (!closed) {
                logger.log(Level.SEVERE, "Failed to schedule next catch-up cycle", e);
            }
        }
    }

    private void fire() {
        logger.log(Level.INFO, "Running scheduled catch-up");
        runOnce();
        scheduleNext();
    }

    /**
     * Cancels the schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (nextRun != null) {
            nextRun.cancel(false);
            nextRun = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link CatchUpTrigger}.
     */
    public static final class Builder {
        private AuthorizationCache cache;
        private CatchUpReconciler reconciler;
        private ConnectionProvider connectionProvider;
        private SourceStore sourceStore;
        private ScheduleParser parser;
        private String defaultExpression = "*/10 * * * *";
        private Duration recheckInterval = Duration.ofMinutes(10);
        private Duration initialDelay = Duration.ofSeconds(10);
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the cache refreshed at the start of every cycle.
         *
         * <p><b>Required.</b>
         *
         * @param cache the authorization cache
         * @return this builder
         */
        public Builder cache(AuthorizationCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param reconciler the reconciler run by every cycle
         * @return this builder
         */
        public Builder reconciler(CatchUpReconciler reconciler) {
            this.reconciler = reconciler;
            return this;
        }

        /**
         * Sets the registry access used to read the schedule override.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider connections for the source store
         * @param sourceStore        the source registry
         * @return this builder
         */
        public Builder registry(ConnectionProvider connectionProvider, SourceStore sourceStore) {
            this.connectionProvider = connectionProvider;
            this.sourceStore = sourceStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param parser the five-field cron parser
         * @return this builder
         */
        public Builder parser(ScheduleParser parser) {
            this.parser = parser;
            return this;
        }

        /**
         * Sets the expression used when the registry has no override.
         *
         * <p>Optional. Defaults to {@code *}{@code /10 * * * *} (every ten minutes).
         *
         * @param defaultExpression five-field cron expression
         * @return this builder
         */
        public Builder defaultExpression(String defaultExpression) {
            this.defaultExpression = defaultExpression;
            return this;
        }

        /**
         * Sets how long to wait before re-reading a malformed schedule.
         *
         * <p>Optional. Defaults to 10 minutes. Must be positive.
         *
         * @param recheckInterval recheck delay
         * @return this builder
         */
        public Builder recheckInterval(Duration recheckInterval) {
            this.recheckInterval = recheckInterval;
            return this;
        }

        /**
         * Sets the delay of the catch-up run triggered by {@link CatchUpTrigger#start()}.
         *
         * <p>Optional. Defaults to 10 seconds; {@code null} disables the initial run.
         *
         * @param initialDelay delay after start, or {@code null}
         * @return this builder
         */
        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @return a new trigger; call {@link CatchUpTrigger#start()} to schedule it
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if {@code recheckInterval} is not positive or
         *                                  {@code initialDelay} is negative
         */
        public CatchUpTrigger build() {
            return new CatchUpTrigger(this);
        }
    }
}
