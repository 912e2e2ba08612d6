package relay.reconcile;

import relay.DeliveryResult;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.model.Source;
import relay.model.Watermark;
import relay.resolve.SourceResolutionException;
import relay.resolve.SourceResolver;
import relay.spi.ConnectionProvider;
import relay.spi.DeliverySink;
import relay.spi.MetricsExporter;
import relay.spi.SourceClient;
import relay.spi.SourceStore;
import relay.spi.WatermarkStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backfills events missed by the real-time path.
 *
 * <p>For each source the reconciler reads the watermark, fetches history newer than it
 * (newest first) and stops at the first event older than {@code now - window}. The window
 * applies even when the watermark is older, so an outage longer than the window leaves a
 * gap that the watermark then moves past. Collected events are reversed into chronological
 * order and delivered in fixed-size chunks, one chunk at a time.
 *
 * <p>The first failed chunk in the process lifetime is retried once after a backoff (see
 * {@link GraceRetry}); any other failure is logged and the run continues with the next
 * chunk. After the last chunk the watermark is advanced to the highest fetched id, whatever
 * the chunk outcomes were.
 *
 * <p>Create instances via {@link #builder()}. Runs are sequential; the class is safe to call
 * from several threads but does not parallelize sources.
 *
 * @see CatchUpReconciler.Builder
 */
public final class CatchUpReconciler {
  private static final Logger logger = Logger.getLogger(CatchUpReconciler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SourceStore sourceStore;
  private final WatermarkStore watermarkStore;
  private final SourceClient sourceClient;
  private final DeliverySink sink;
  private final SourceResolver resolver;
  private final GraceRetry graceRetry;
  private final Duration window;
  private final int chunkSize;
  private final Duration retryBackoff;
  private final Clock clock;
  private final MetricsExporter metrics;

  private CatchUpReconciler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.sourceStore = Objects.requireNonNull(builder.sourceStore, "sourceStore");
    this.watermarkStore = Objects.requireNonNull(builder.watermarkStore, "watermarkStore");
    this.sourceClient = Objects.requireNonNull(builder.sourceClient, "sourceClient");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.resolver = builder.resolver != null
        ? builder.resolver : new SourceResolver(connectionProvider, sourceStore, sourceClient);
    this.graceRetry = builder.graceRetry != null ? builder.graceRetry : GraceRetry.processWide();
    this.window = Objects.requireNonNull(builder.window, "window");
    this.retryBackoff = Objects.requireNonNull(builder.retryBackoff, "retryBackoff");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (retryBackoff.isNegative()) {
      throw new IllegalArgumentException("retryBackoff must be >= 0");
    }
    if (builder.chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
    this.chunkSize = builder.chunkSize;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reconciles every source with an active subscription, one after another.
   *
   * @return one report per source; empty if the registry could not be read
   */
  public List<ReconcileReport> reconcileAll() {
    List<Source> sources;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      sources = sourceStore.listActiveSubscribed(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to list sources for catch-up", e);
      return List.of();
    }

    logger.log(Level.INFO, "Running catch-up for {0} sources", sources.size());
    List<ReconcileReport> reports = new ArrayList<>(sources.size());
    for (Source source : sources) {
      reports.add(reconcileOne(source));
    }
    return reports;
  }

  /**
   * Reconciles one source with the configured window.
   */
  public ReconcileReport reconcileOne(Source source) {
    return reconcileOne(source, window);
  }

  /**
   * Reconciles one source.
   *
   * @param source registry source, resolved or not
   * @param window how far back to look, regardless of the watermark
   * @return the outcome
   */
  public ReconcileReport reconcileOne(Source source, Duration window) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(window, "window");

    Source resolved;
    try {
      resolved = resolver.resolve(source);
    } catch (SourceResolutionException e) {
      logger.log(Level.WARNING, "Skipping catch-up for source " + source.id() + ": " + e.getMessage(), e);
      return ReconcileReport.skipped(source.id(), "unresolved: " + e.getMessage());
    }

    Watermark current = readWatermark(resolved.id());
    long minId = current.lastSeenId();
    Instant cutoff = clock.instant().minus(window);
    logger.log(Level.INFO, "Catching up {0} (external id {1}, min id {2}, window {3})",
        new Object[]{resolved.url(), String.valueOf(resolved.externalId()), String.valueOf(minId), window});

    List<ChannelEvent> events;
    try {
      events = fetch(resolved, minId, cutoff);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "History fetch failed for " + resolved.url(), e);
      return ReconcileReport.skipped(resolved.id(), "fetch failed: " + e.getMessage());
    }
    metrics.incrementCatchUpEvents(events.size());
    if (events.isEmpty()) {
      logger.log(Level.FINE, "Nothing to catch up for {0}", resolved.url());
      return new ReconcileReport(resolved.id(), 0, 0, 0, minId, null);
    }

    DeliveryTarget target = targetFor(resolved);
    int delivered = 0;
    int failed = 0;
    for (int from = 0; from < events.size(); from += chunkSize) {
      List<ChannelEvent> chunk = events.subList(from, Math.min(from + chunkSize, events.size()));
      if (deliverChunk(target, chunk)) {
        delivered++;
      } else {
        failed++;
      }
    }

    ChannelEvent newest = events.get(events.size() - 1);
    long watermark = advanceWatermark(current, newest);
    logger.log(Level.INFO, "Catch-up complete for {0}: {1} events, {2} chunks delivered, {3} failed",
        new Object[]{resolved.url(), events.size(), delivered, failed});
    return new ReconcileReport(resolved.id(), events.size(), delivered, failed, watermark, null);
  }

  private Watermark readWatermark(long sourceId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return watermarkStore.find(conn, sourceId).orElseGet(() -> Watermark.none(sourceId));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read watermark for source " + sourceId + "; starting from 0", e);
      return Watermark.none(sourceId);
    }
  }

  /** Returns events above {@code minId} and inside the window, oldest first. */
  private List<ChannelEvent> fetch(Source source, long minId, Instant cutoff) {
    List<ChannelEvent> newestFirst = new ArrayList<>();
    for (ChannelEvent event : sourceClient.history(source, minId)) {
      if (event.date().isBefore(cutoff)) {
        break;
      }
      if (event.sequenceId() <= minId) {
        continue;
      }
      newestFirst.add(event);
    }
    Collections.reverse(newestFirst);
    return newestFirst;
  }

  private DeliveryTarget targetFor(Source source) {
    if (source.handle() != null && !source.handle().isEmpty()) {
      return DeliveryTarget.of(source, null);
    }
    String handle;
    try {
      handle = sourceClient.lookupHandle(source.externalId()).orElse(null);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Username lookup failed for " + source.externalId(), e);
      handle = null;
    }
    return DeliveryTarget.of(source, handle);
  }

  private boolean deliverChunk(DeliveryTarget target, List<ChannelEvent> chunk) {
    DeliveryResult result = attempt(target, chunk);
    if (!result.isAccepted() && graceRetry.tryConsume()) {
      metrics.incrementCatchUpRetry();
      logger.log(Level.WARNING, "Catch-up delivery for channel {0} failed; retrying once in {1}",
          new Object[]{String.valueOf(target.channelId()), retryBackoff});
      try {
        Thread.sleep(retryBackoff.toMillis());
        result = attempt(target, chunk);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    if (result instanceof DeliveryResult.Accepted accepted) {
      metrics.incrementDeliverySuccess();
      logger.log(Level.INFO, "Sent catch-up chunk of {0} events for @{1} (sink processed {2})",
          new Object[]{chunk.size(), target.channelUsername(), accepted.processed()});
      return true;
    }
    DeliveryResult.Rejected rejected = (DeliveryResult.Rejected) result;
    metrics.incrementDeliveryFailure();
    logger.log(Level.SEVERE, "Failed to send catch-up chunk of " + chunk.size() + " events for channel "
        + target.channelId() + ": [" + rejected.code() + "] " + rejected.message());
    return false;
  }

  private DeliveryResult attempt(DeliveryTarget target, List<ChannelEvent> chunk) {
    try {
      return sink.deliver(target, List.copyOf(chunk), null);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Sink threw for channel " + target.channelId(), e);
      return DeliveryResult.rejected(String.valueOf(e.getMessage()), DeliveryResult.UNEXPECTED_ERROR);
    }
  }

  private long advanceWatermark(Watermark current, ChannelEvent newest) {
    long sourceId = current.sourceId();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      watermarkStore.upsert(conn, sourceId, newest.sequenceId(), newest.date());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to advance watermark for source " + sourceId, e);
      return current.lastSeenId();
    }
    return current.merge(newest.sequenceId(), newest.date()).lastSeenId();
  }

  /** Builder for {@link CatchUpReconciler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SourceStore sourceStore;
    private WatermarkStore watermarkStore;
    private SourceClient sourceClient;
    private DeliverySink sink;
    private SourceResolver resolver;
    private GraceRetry graceRetry;
    private Duration window = Duration.ofMinutes(60);
    private int chunkSize = 50;
    private Duration retryBackoff = Duration.ofSeconds(5);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sourceStore(SourceStore sourceStore) {
      this.sourceStore = sourceStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder watermarkStore(WatermarkStore watermarkStore) {
      this.watermarkStore = watermarkStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sourceClient(SourceClient sourceClient) {
      this.sourceClient = sourceClient;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sink(DeliverySink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Optional. Defaults to a resolver over the configured store and client.
     */
    public Builder resolver(SourceResolver resolver) {
      this.resolver = resolver;
      return this;
    }

    /**
     * Optional. Defaults to {@link GraceRetry#processWide()}.
     */
    public Builder graceRetry(GraceRetry graceRetry) {
      this.graceRetry = graceRetry;
      return this;
    }

    /**
     * Sets how far back a run looks. Optional. Defaults to 60 minutes.
     */
    public Builder window(Duration window) {
      this.window = window;
      return this;
    }

    /**
     * Sets the number of events per sink call. Optional. Defaults to {@code 50}.
     */
    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    /**
     * Sets the wait before the one-shot retry. Optional. Defaults to 5 seconds.
     */
    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code window}, {@code chunkSize} or
     *                                  {@code retryBackoff} is out of range
     */
    public CatchUpReconciler build() {
      return new CatchUpReconciler(this);
    }
  }
}
