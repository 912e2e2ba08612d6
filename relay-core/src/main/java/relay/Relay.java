package relay;

import relay.cache.AuthorizationCache;
import relay.dispatch.BatchDispatcher;
import relay.ingest.FilteringIngestListener;
import relay.reconcile.CatchUpReconciler;
import relay.reconcile.GraceRetry;
import relay.resolve.SourceResolver;
import relay.schedule.CatchUpTrigger;
import relay.spi.ConnectionProvider;
import relay.spi.DeliverySink;
import relay.spi.IngestListener;
import relay.spi.MetricsExporter;
import relay.spi.ScheduleParser;
import relay.spi.SourceClient;
import relay.spi.SourceStore;
import relay.spi.WatermarkStore;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the authorization cache, dispatcher, reconciler and
 * catch-up trigger into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Relay relay = Relay.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .sourceStore(new JdbcSourceStore())
 *     .watermarkStore(JdbcWatermarkStores.detect(dataSource))
 *     .sourceClient(client)
 *     .sink(HttpDeliverySink.builder().baseUrl(url).token(token).build())
 *     .scheduleParser(new SpringCronScheduleParser())
 *     .build()) {
 *   relay.start();
 *   client.onMessage(relay.ingestListener());
 *   // run until shutdown
 * }
 * }</pre>
 *
 * @see AuthorizationCache
 * @see BatchDispatcher
 * @see CatchUpReconciler
 * @see CatchUpTrigger
 */
public final class Relay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Relay.class.getName());

  private final AuthorizationCache cache;
  private final BatchDispatcher dispatcher;
  private final CatchUpReconciler reconciler;
  private final CatchUpTrigger trigger;
  private final IngestListener ingestListener;
  private final MetricsExporter metrics;

  private Relay(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.sourceStore, "sourceStore");
    Objects.requireNonNull(builder.watermarkStore, "watermarkStore");
    Objects.requireNonNull(builder.sourceClient, "sourceClient");
    Objects.requireNonNull(builder.sink, "sink");
    Objects.requireNonNull(builder.scheduleParser, "scheduleParser");
    Objects.requireNonNull(builder.defaultSchedule, "defaultSchedule");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    SourceResolver resolver = new SourceResolver(
        builder.connectionProvider, builder.sourceStore, builder.sourceClient);
    this.reconciler = CatchUpReconciler.builder()
        .connectionProvider(builder.connectionProvider)
        .sourceStore(builder.sourceStore)
        .watermarkStore(builder.watermarkStore)
        .sourceClient(builder.sourceClient)
        .sink(builder.sink)
        .resolver(resolver)
        .graceRetry(builder.graceRetry)
        .window(builder.catchUpWindow)
        .chunkSize(builder.chunkSize)
        .retryBackoff(builder.retryBackoff)
        .metrics(metrics)
        .build();

    this.cache = AuthorizationCache.builder()
        .connectionProvider(builder.connectionProvider)
        .sourceStore(builder.sourceStore)
        .resolver(resolver)
        .ttl(builder.cacheTtl)
        .metrics(metrics)
        .build();

    BatchDispatcher createdDispatcher = null;
    try {
      BatchDispatcher.Builder dispatcherBuilder = BatchDispatcher.builder()
          .sink(builder.sink)
          .quietPeriod(builder.quietPeriod)
          .maxWait(builder.maxWait)
          .workerCount(builder.workerCount)
          .drainTimeoutMs(builder.drainTimeoutMs)
          .metrics(metrics);
      if (builder.realtimeWatermarks) {
        dispatcherBuilder.watermarks(builder.connectionProvider, builder.watermarkStore);
      }
      createdDispatcher = dispatcherBuilder.build();

      this.trigger = CatchUpTrigger.builder()
          .cache(cache)
          .reconciler(reconciler)
          .registry(builder.connectionProvider, builder.sourceStore)
          .parser(builder.scheduleParser)
          .defaultExpression(builder.defaultSchedule)
          .recheckInterval(builder.scheduleRecheckInterval)
          .initialDelay(builder.initialCatchUpDelay)
          .build();
    } catch (RuntimeException e) {
      if (createdDispatcher != null) {
        createdDispatcher.close();
      }
      cache.close();
      throw e;
    }
    this.dispatcher = createdDispatcher;

    this.ingestListener = new FilteringIngestListener(cache, dispatcher, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the authorization cache and starts the catch-up schedule.
   */
  public void start() {
    cache.refresh();
    trigger.start();
    logger.log(Level.INFO, "Relay started with {0} active sources", cache.snapshot().sources().size());
  }

  /** Callback to register with the protocol client. */
  public IngestListener ingestListener() {
    return ingestListener;
  }

  public AuthorizationCache cache() {
    return cache;
  }

  public BatchDispatcher dispatcher() {
    return dispatcher;
  }

  public CatchUpReconciler reconciler() {
    return reconciler;
  }

  public CatchUpTrigger trigger() {
    return trigger;
  }

  /**
   * Stops the trigger, flushes and drains the dispatcher, then releases the cache.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      trigger.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      cache.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Relay}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SourceStore sourceStore;
    private WatermarkStore watermarkStore;
    private SourceClient sourceClient;
    private DeliverySink sink;
    private ScheduleParser scheduleParser;
    private MetricsExporter metrics;
    private GraceRetry graceRetry;
    private String defaultSchedule = "*/10 * * * *";
    private Duration scheduleRecheckInterval = Duration.ofMinutes(10);
    private Duration initialCatchUpDelay = Duration.ofSeconds(10);
    private Duration cacheTtl = Duration.ofSeconds(30);
    private Duration quietPeriod = Duration.ofSeconds(1);
    private Duration maxWait = Duration.ofSeconds(5);
    private int workerCount = 2;
    private long drainTimeoutMs = 5000;
    private boolean realtimeWatermarks = true;
    private Duration catchUpWindow = Duration.ofMinutes(60);
    private int chunkSize = 50;
    private Duration retryBackoff = Duration.ofSeconds(5);

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

    /** <b>Required.</b> */
    public Builder scheduleParser(ScheduleParser scheduleParser) {
      this.scheduleParser = scheduleParser;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder graceRetry(GraceRetry graceRetry) {
      this.graceRetry = graceRetry;
      return this;
    }

    public Builder defaultSchedule(String defaultSchedule) {
      this.defaultSchedule = defaultSchedule;
      return this;
    }

    public Builder scheduleRecheckInterval(Duration scheduleRecheckInterval) {
      this.scheduleRecheckInterval = scheduleRecheckInterval;
      return this;
    }

    /** {@code null} disables the catch-up run that follows {@link Relay#start()}. */
    public Builder initialCatchUpDelay(Duration initialCatchUpDelay) {
      this.initialCatchUpDelay = initialCatchUpDelay;
      return this;
    }

    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder quietPeriod(Duration quietPeriod) {
      this.quietPeriod = quietPeriod;
      return this;
    }

    public Builder maxWait(Duration maxWait) {
      this.maxWait = maxWait;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Whether batches accepted on the real-time path advance the watermark. Defaults to
     * {@code true}.
     */
    public Builder realtimeWatermarks(boolean realtimeWatermarks) {
      this.realtimeWatermarks = realtimeWatermarks;
      return this;
    }

    public Builder catchUpWindow(Duration catchUpWindow) {
      this.catchUpWindow = catchUpWindow;
      return this;
    }

    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a timing or pool setting is invalid
     */
    public Relay build() {
      return new Relay(this);
    }
  }
}
