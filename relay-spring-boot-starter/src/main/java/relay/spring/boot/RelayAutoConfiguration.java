package relay.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import relay.Relay;
import relay.http.HttpDeliverySink;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.TableNames;
import relay.jdbc.store.AbstractJdbcWatermarkStore;
import relay.jdbc.store.H2WatermarkStore;
import relay.jdbc.store.JdbcSourceStore;
import relay.jdbc.store.JdbcWatermarkStores;
import relay.jdbc.store.MySqlWatermarkStore;
import relay.jdbc.store.PostgresWatermarkStore;
import relay.spi.ConnectionProvider;
import relay.spi.DeliverySink;
import relay.spi.IngestListener;
import relay.spi.MetricsExporter;
import relay.spi.ScheduleParser;
import relay.spi.SourceClient;
import relay.spi.SourceStore;
import relay.spi.WatermarkStore;

import javax.sql.DataSource;

/**
 * Auto-configuration for the relay.
 *
 * <p>Wires a {@link Relay} from a {@link DataSource}, {@link RelayProperties} and an
 * application-provided {@link SourceClient}. The relay is started once the context is up
 * and closed with it.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(Relay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(WatermarkStore.class)
  public AbstractJdbcWatermarkStore watermarkStore(DataSource dataSource, RelayProperties props) {
    String tableName = props.getTables().getWatermark();
    AbstractJdbcWatermarkStore detected = JdbcWatermarkStores.detect(dataSource);
    if (!TableNames.WATERMARK.equals(tableName)) {
      return switch (detected.name()) {
        case "h2" -> new H2WatermarkStore(tableName);
        case "mysql" -> new MySqlWatermarkStore(tableName);
        case "postgresql" -> new PostgresWatermarkStore(tableName);
        default -> detected;
      };
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(SourceStore.class)
  public JdbcSourceStore sourceStore(RelayProperties props) {
    RelayProperties.Tables tables = props.getTables();
    return new JdbcSourceStore(tables.getSource(), tables.getSubscription(), tables.getConfig());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(DeliverySink.class)
  public HttpDeliverySink deliverySink(RelayProperties props) {
    RelayProperties.Sink sink = props.getSink();
    if (sink.getToken() == null || sink.getToken().isBlank()) {
      throw new IllegalStateException("relay.sink.token must be set");
    }
    return HttpDeliverySink.builder()
        .baseUrl(sink.getBaseUrl())
        .path(sink.getPath())
        .token(sink.getToken())
        .timeout(sink.getTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ScheduleParser scheduleParser() {
    return new SpringCronScheduleParser();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(SourceClient.class)
  public Relay relay(RelayProperties props,
      ConnectionProvider connectionProvider,
      SourceStore sourceStore,
      WatermarkStore watermarkStore,
      SourceClient sourceClient,
      DeliverySink deliverySink,
      ScheduleParser scheduleParser,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var schedule = props.getSchedule();
    var dispatcher = props.getDispatcher();
    var catchUp = props.getCatchUp();
    var builder = Relay.builder()
        .connectionProvider(connectionProvider)
        .sourceStore(sourceStore)
        .watermarkStore(watermarkStore)
        .sourceClient(sourceClient)
        .sink(deliverySink)
        .scheduleParser(scheduleParser)
        .defaultSchedule(schedule.getCron())
        .scheduleRecheckInterval(schedule.getRecheckInterval())
        .initialCatchUpDelay(schedule.isRunOnStartup() ? schedule.getInitialDelay() : null)
        .cacheTtl(props.getCache().getTtl())
        .quietPeriod(dispatcher.getQuietPeriod())
        .maxWait(dispatcher.getMaxWait())
        .workerCount(dispatcher.getWorkerCount())
        .drainTimeoutMs(dispatcher.getDrainTimeoutMs())
        .realtimeWatermarks(dispatcher.isRealtimeWatermarks())
        .catchUpWindow(catchUp.getWindow())
        .chunkSize(catchUp.getChunkSize())
        .retryBackoff(catchUp.getRetryBackoff());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(Relay.class)
  public IngestListener ingestListener(Relay relay) {
    return relay.ingestListener();
  }
}
