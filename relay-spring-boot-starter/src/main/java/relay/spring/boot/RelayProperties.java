package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

  private final Schedule schedule = new Schedule();
  private final Sink sink = new Sink();
  private final Dispatcher dispatcher = new Dispatcher();
  private final Cache cache = new Cache();
  private final CatchUp catchUp = new CatchUp();
  private final Tables tables = new Tables();
  private final Metrics metrics = new Metrics();

  public Schedule getSchedule() {
    return schedule;
  }

  public Sink getSink() {
    return sink;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Cache getCache() {
    return cache;
  }

  public CatchUp getCatchUp() {
    return catchUp;
  }

  public Tables getTables() {
    return tables;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Schedule {
    /**
     * Five-field cron expression used when the registry holds none.
     */
    private String cron = "*/10 * * * *";

    /**
     * Delay before the schedule is re-read when no fire time can be computed.
     */
    private Duration recheckInterval = Duration.ofMinutes(10);

    /**
     * Whether to run one catch-up pass shortly after startup.
     */
    private boolean runOnStartup = true;

    private Duration initialDelay = Duration.ofSeconds(10);

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public Duration getRecheckInterval() {
      return recheckInterval;
    }

    public void setRecheckInterval(Duration recheckInterval) {
      this.recheckInterval = recheckInterval;
    }

    public boolean isRunOnStartup() {
      return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
      this.runOnStartup = runOnStartup;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }
  }

  public static class Sink {
    private String baseUrl = "http://localhost:6969";
    private String path = "process";

    /**
     * Bearer token for the processing endpoint. Required.
     */
    private String token;

    private Duration timeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }

  public static class Dispatcher {
    private Duration quietPeriod = Duration.ofSeconds(1);
    private Duration maxWait = Duration.ofSeconds(5);
    private int workerCount = 2;
    private long drainTimeoutMs = 5000;

    /**
     * Whether batches accepted on the real-time path advance the watermark.
     */
    private boolean realtimeWatermarks = true;

    public Duration getQuietPeriod() {
      return quietPeriod;
    }

    public void setQuietPeriod(Duration quietPeriod) {
      this.quietPeriod = quietPeriod;
    }

    public Duration getMaxWait() {
      return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
      this.maxWait = maxWait;
    }

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }

    public boolean isRealtimeWatermarks() {
      return realtimeWatermarks;
    }

    public void setRealtimeWatermarks(boolean realtimeWatermarks) {
      this.realtimeWatermarks = realtimeWatermarks;
    }
  }

  public static class Cache {
    private Duration ttl = Duration.ofSeconds(30);

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }
  }

  public static class CatchUp {
    /**
     * How far back a source with no watermark is read.
     */
    private Duration window = Duration.ofMinutes(60);
    private int chunkSize = 50;
    private Duration retryBackoff = Duration.ofSeconds(5);

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public int getChunkSize() {
      return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
    }

    public Duration getRetryBackoff() {
      return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
    }
  }

  public static class Tables {
    private String source = "relay_source";
    private String subscription = "relay_subscription";
    private String config = "relay_config";
    private String watermark = "relay_watermark";

    public String getSource() {
      return source;
    }

    public void setSource(String source) {
      this.source = source;
    }

    public String getSubscription() {
      return subscription;
    }

    public void setSubscription(String subscription) {
      this.subscription = subscription;
    }

    public String getConfig() {
      return config;
    }

    public void setConfig(String config) {
      this.config = config;
    }

    public String getWatermark() {
      return watermark;
    }

    public void setWatermark(String watermark) {
      this.watermark = watermark;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "relay";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
