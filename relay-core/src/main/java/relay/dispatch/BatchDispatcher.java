package relay.dispatch;

import relay.DeliveryResult;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.spi.ConnectionProvider;
import relay.spi.DeliverySink;
import relay.spi.MetricsExporter;
import relay.spi.WatermarkStore;
import relay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns bursty real-time events into right-sized delivery batches, per source.
 *
 * <p>Each source moves through {@code Idle -> Accumulating -> Idle}. The first event starts a
 * batch and arms a quiet-period timer; every further event restarts the timer, coalescing
 * bursts. When the batch has been open for {@code maxWait} the next event flushes it
 * immediately, so a steady trickle cannot postpone delivery forever.
 *
 * <p>State for one source lives in a {@link SourceLane} guarded by its own monitor; sources
 * never contend with each other. Flushing pops the batch under the monitor and hands it to a
 * delivery worker, so a new batch can start accumulating while the previous one is on the
 * wire. Popped batches of one source are delivered one at a time in pop order.
 *
 * <p>Accepted batches advance the source's watermark when a {@link WatermarkStore} is
 * configured. Rejected or failed batches are logged with their id and size; nothing is
 * dropped silently.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see BatchDispatcher.Builder
 * @see relay.ingest.FilteringIngestListener
 */
public final class BatchDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchDispatcher.class.getName());

  private final DeliverySink sink;
  private final ConnectionProvider connectionProvider;
  private final WatermarkStore watermarkStore;
  private final long quietPeriodMs;
  private final long maxWaitNanos;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;

  private final Map<Long, SourceLane> lanes = new ConcurrentHashMap<>();
  private final ScheduledExecutorService timers;
  private final ExecutorService workers;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger pendingEvents = new AtomicInteger();

  private BatchDispatcher(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    if ((builder.watermarkStore == null) != (builder.connectionProvider == null)) {
      throw new IllegalArgumentException("watermarkStore and connectionProvider must be set together");
    }
    this.watermarkStore = builder.watermarkStore;
    this.connectionProvider = builder.connectionProvider;

    Duration quietPeriod = Objects.requireNonNull(builder.quietPeriod, "quietPeriod");
    Duration maxWait = Objects.requireNonNull(builder.maxWait, "maxWait");
    if (quietPeriod.isNegative() || quietPeriod.isZero()) {
      throw new IllegalArgumentException("quietPeriod must be positive");
    }
    if (maxWait.compareTo(quietPeriod) < 0) {
      throw new IllegalArgumentException("maxWait must be >= quietPeriod");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.quietPeriodMs = quietPeriod.toMillis();
    this.maxWaitNanos = maxWait.toNanos();
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    this.timers = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-debounce-"));
    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("relay-delivery-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Buffers an event for its source. Never blocks on I/O.
   *
   * @param sourceExternalId external id of the source
   * @param event            the event
   * @param target           delivery metadata; only the first event's target is kept per batch
   */
  public void onEvent(long sourceExternalId, ChannelEvent event, DeliveryTarget target) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(target, "target");
    if (!accepting.get()) {
      logger.log(Level.WARNING, "Dispatcher closed; dropping event " + event.sequenceId()
          + " for source " + sourceExternalId);
      return;
    }

    SourceLane lane = lanes.computeIfAbsent(sourceExternalId, SourceLane::new);
    boolean drain;
    synchronized (lane) {
      // close() clears accepting before it flushes lanes under this monitor
      if (!accepting.get()) {
        logger.log(Level.WARNING, "Dispatcher closed; dropping event " + event.sequenceId()
            + " for source " + sourceExternalId);
        return;
      }
      long now = System.nanoTime();
      PendingBatch batch = lane.pending();
      if (batch == null) {
        batch = new PendingBatch(target, now);
        lane.begin(batch);
      }
      batch.add(event);
      pendingEvents.incrementAndGet();

      if (now - batch.startedAtNanos() >= maxWaitNanos) {
        logger.log(Level.FINE, "Max wait reached for source {0}; flushing {1} events",
            new Object[]{String.valueOf(sourceExternalId), batch.size()});
        drain = pop(lane);
      } else {
        armTimer(lane);
        drain = false;
      }
    }
    metrics.recordPendingEvents(pendingEvents.get());
    if (drain) {
      startDrain(lane);
    }
  }

  /**
   * Pops the pending batch of a source, if any, and schedules its delivery.
   *
   * @param sourceExternalId external id of the source
   * @return {@code true} if a batch was popped
   */
  public boolean flush(long sourceExternalId) {
    SourceLane lane = lanes.get(sourceExternalId);
    if (lane == null) {
      return false;
    }
    boolean drain;
    boolean popped;
    synchronized (lane) {
      popped = lane.pending() != null;
      drain = pop(lane);
    }
    if (drain) {
      startDrain(lane);
    }
    return popped;
  }

  /**
   * Returns the number of events buffered for a source and not yet popped.
   */
  public int pendingCount(long sourceExternalId) {
    SourceLane lane = lanes.get(sourceExternalId);
    if (lane == null) {
      return 0;
    }
    synchronized (lane) {
      PendingBatch batch = lane.pending();
      return batch == null ? 0 : batch.size();
    }
  }

  // Caller holds the lane monitor.
  private void armTimer(SourceLane lane) {
    long generation = lane.nextGeneration();
    ScheduledFuture<?> future = timers.schedule(
        () -> onTimer(lane, generation), quietPeriodMs, TimeUnit.MILLISECONDS);
    lane.replaceTimer(new DebounceTimer(future, generation));
  }

  private void onTimer(SourceLane lane, long generation) {
    boolean drain;
    synchronized (lane) {
      if (!lane.isCurrent(generation)) {
        return;
      }
      drain = pop(lane);
    }
    if (drain) {
      startDrain(lane);
    }
  }

  // Caller holds the lane monitor. Returns true if a drain task must be started.
  private boolean pop(SourceLane lane) {
    PendingBatch batch = lane.popToOutbound();
    if (batch == null) {
      return false;
    }
    pendingEvents.addAndGet(-batch.size());
    metrics.incrementBatchFlushed();
    return lane.claimDrain();
  }

  private void startDrain(SourceLane lane) {
    metrics.recordPendingEvents(pendingEvents.get());
    try {
      workers.execute(() -> drain(lane));
    } catch (RejectedExecutionException e) {
      int dropped;
      synchronized (lane) {
        dropped = lane.abandonOutbound();
      }
      metrics.incrementDeliveryFailure();
      logger.log(Level.WARNING, "Delivery workers unavailable; dropped " + dropped
          + " events for source " + lane.externalId(), e);
    }
  }

  private void drain(SourceLane lane) {
    boolean finished = false;
    try {
      while (true) {
        PendingBatch batch;
        synchronized (lane) {
          batch = lane.nextOutbound();
        }
        if (batch == null) {
          finished = true;
          return;
        }
        deliver(batch);
      }
    } finally {
      if (!finished) {
        boolean restart;
        synchronized (lane) {
          restart = lane.releaseDrain();
        }
        if (restart) {
          startDrain(lane);
        }
      }
    }
  }

  private void deliver(PendingBatch batch) {
    DeliveryTarget target = batch.target();
    DeliveryResult result;
    try {
      result = sink.deliver(target, batch.events(), batch.batchId());
    } catch (Throwable t) {
      metrics.incrementDeliveryFailure();
      logger.log(Level.SEVERE, "Delivery of batch " + batch.batchId() + " (" + batch.size()
          + " events) for channel " + target.channelId() + " failed", t);
      return;
    }

    if (result instanceof DeliveryResult.Accepted accepted) {
      metrics.incrementDeliverySuccess();
      logger.log(Level.INFO, "Delivered batch {0} for @{1}: {2} events (sink processed {3}, pending {4})",
          new Object[]{batch.batchId(), target.channelUsername(), batch.size(),
              accepted.processed(), accepted.pending()});
      advanceWatermark(batch);
    } else if (result instanceof DeliveryResult.Rejected rejected) {
      metrics.incrementDeliveryFailure();
      logger.log(Level.WARNING, "Sink rejected batch " + batch.batchId() + " (" + batch.size()
          + " events) for channel " + target.channelId() + ": [" + rejected.code() + "] "
          + rejected.message());
    }
  }

  private void advanceWatermark(PendingBatch batch) {
    if (watermarkStore == null) {
      return;
    }
    long sourceId = batch.target().sourceId();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      watermarkStore.upsert(conn, sourceId, batch.maxSequenceId(), batch.latestDate());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to advance watermark for source " + sourceId
          + " after batch " + batch.batchId(), e);
    }
  }

  /**
   * Stops accepting events, flushes every pending batch and waits up to the drain timeout
   * for deliveries to finish.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    for (Long sourceExternalId : lanes.keySet()) {
      flush(sourceExternalId);
    }
    timers.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with "
            + undeliveredEvents() + " events undelivered");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private int undeliveredEvents() {
    int total = 0;
    for (SourceLane lane : lanes.values()) {
      synchronized (lane) {
        total += lane.abandonOutbound();
      }
    }
    return total;
  }

  /** Builder for {@link BatchDispatcher}. */
  public static final class Builder {
    private DeliverySink sink;
    private ConnectionProvider connectionProvider;
    private WatermarkStore watermarkStore;
    private Duration quietPeriod = Duration.ofSeconds(1);
    private Duration maxWait = Duration.ofSeconds(5);
    private int workerCount = 2;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the sink receiving flushed batches.
     *
     * <p><b>Required.</b>
     *
     * @param sink the delivery sink
     * @return this builder
     */
    public Builder sink(DeliverySink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Enables watermark advancement after accepted batches.
     *
     * <p>Optional. When set, both arguments are required.
     *
     * @param connectionProvider connections for the watermark store
     * @param watermarkStore     the watermark store
     * @return this builder
     */
    public Builder watermarks(ConnectionProvider connectionProvider, WatermarkStore watermarkStore) {
      this.connectionProvider = connectionProvider;
      this.watermarkStore = watermarkStore;
      return this;
    }

    /**
     * Sets the quiet period after the last event before a batch is flushed.
     *
     * <p>Optional. Defaults to 1 second. Must be positive.
     *
     * @param quietPeriod debounce delay
     * @return this builder
     */
    public Builder quietPeriod(Duration quietPeriod) {
      this.quietPeriod = quietPeriod;
      return this;
    }

    /**
     * Sets how long a batch may stay open before the next event forces a flush.
     *
     * <p>Optional. Defaults to 5 seconds. Must be &ge; the quiet period.
     *
     * @param maxWait hard cap on batch age
     * @return this builder
     */
    public Builder maxWait(Duration maxWait) {
      this.maxWait = maxWait;
      return this;
    }

    /**
     * Sets the number of delivery worker threads.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &gt; 0.
     *
     * @param workerCount number of workers
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long {@link BatchDispatcher#close()} waits for in-flight deliveries.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @return a new {@link BatchDispatcher}
     * @throws NullPointerException     if {@code sink} is null
     * @throws IllegalArgumentException if a timing or pool setting is invalid
     */
    public BatchDispatcher build() {
      return new BatchDispatcher(this);
    }
  }
}
