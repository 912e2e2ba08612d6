package relay.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import relay.DeliveryResult;
import relay.Relay;
import relay.http.HttpDeliverySink;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.store.AbstractJdbcWatermarkStore;
import relay.jdbc.store.H2WatermarkStore;
import relay.jdbc.store.JdbcSourceStore;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.model.ResolvedIdentity;
import relay.model.Source;
import relay.reconcile.ReconcileReport;
import relay.spi.ConnectionProvider;
import relay.spi.DeliverySink;
import relay.spi.IngestListener;
import relay.spi.ScheduleParser;
import relay.spi.SourceClient;
import relay.spi.SourceStore;
import relay.spi.WatermarkStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RelayAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          RelayAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:relay_auto_test_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "relay.sink.token=test-token",
          "relay.schedule.cron=0 0 1 1 *",
          "relay.schedule.run-on-startup=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(SourceClientConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertInstanceOf(H2WatermarkStore.class, ctx.getBean(WatermarkStore.class));
      assertInstanceOf(JdbcSourceStore.class, ctx.getBean(SourceStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(HttpDeliverySink.class, ctx.getBean(DeliverySink.class));
      assertInstanceOf(SpringCronScheduleParser.class, ctx.getBean(ScheduleParser.class));
      assertNotNull(ctx.getBean(Relay.class));
      assertSame(ctx.getBean(Relay.class).ingestListener(), ctx.getBean(IngestListener.class));
    });
  }

  @Test
  void sinkUsesConfiguredEndpoint() {
    runner
        .withPropertyValues("relay.sink.base-url=http://sink.internal:8080", "relay.sink.path=/ingest")
        .withUserConfiguration(SourceClientConfig.class).run(ctx -> {
          var sink = ctx.getBean(HttpDeliverySink.class);
          assertEquals("http://sink.internal:8080/ingest", sink.endpoint().toString());
        });
  }

  @Test
  void noRelayWithoutSourceClient() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertTrue(ctx.containsBean("watermarkStore"));
      assertFalse(ctx.containsBean("relay"));
      assertFalse(ctx.containsBean("ingestListener"));
    });
  }

  @Test
  void missingTokenFailsStartup() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            RelayAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:relay_no_token;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver")
        .withUserConfiguration(SourceClientConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void customSinkDoesNotNeedToken() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            SqlInitializationAutoConfiguration.class,
            RelayAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:relay_custom_sink;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "spring.sql.init.schema-locations=classpath:schema/h2.sql",
            "relay.schedule.run-on-startup=false")
        .withUserConfiguration(SourceClientConfig.class, RecordingSinkConfig.class)
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertInstanceOf(RecordingSink.class, ctx.getBean(DeliverySink.class));
          assertFalse(ctx.containsBean("deliverySink"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class, SourceClientConfig.class).run(ctx -> {
      var store = ctx.getBean(AbstractJdbcWatermarkStore.class);
      assertInstanceOf(H2WatermarkStore.class, store);
      assertEquals("myWatermarkStore", ctx.getBeanNamesForType(WatermarkStore.class)[0]);
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RelayAutoConfiguration.class))
        .withUserConfiguration(SourceClientConfig.class)
        .run(ctx -> assertFalse(ctx.containsBean("relay")));
  }

  @Test
  void scheduleDefaultComesFromProperties() {
    runner
        .withPropertyValues("relay.schedule.cron=0 * * * *")
        .withUserConfiguration(SourceClientConfig.class).run(ctx -> {
          assertEquals("0 * * * *", ctx.getBean(Relay.class).trigger().currentExpression());
        });
  }

  @Test
  void catchUpDeliversRegisteredSource() {
    runner.withUserConfiguration(SourceClientConfig.class, RecordingSinkConfig.class).run(ctx -> {
      var store = ctx.getBean(JdbcSourceStore.class);
      try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
        long id = store.register(conn, "https://t.me/news");
        store.subscribe(conn, id, "webhook-1");
      }

      Relay relay = ctx.getBean(Relay.class);
      List<ReconcileReport> reports = relay.reconciler().reconcileAll();

      assertEquals(1, reports.size());
      assertEquals(2, reports.get(0).fetched());
      RecordingSink sink = ctx.getBean(RecordingSink.class);
      assertEquals(1, sink.batches.size());
      assertEquals(List.of(11L, 12L), sink.batches.get(0));
      assertEquals(List.of(500L), sink.channels);
    });
  }

  // ── Test configurations ──────────────────────────────────────

  static class StubSourceClient implements SourceClient {
    @Override
    public Optional<ResolvedIdentity> resolve(String handle) {
      return "news".equals(handle) ? Optional.of(new ResolvedIdentity(500, "news")) : Optional.empty();
    }

    @Override
    public Iterable<ChannelEvent> history(Source source, long minId) {
      Instant now = Instant.now();
      return List.of(
          ChannelEvent.builder(12, now.minusSeconds(30)).message("second").build(),
          ChannelEvent.builder(11, now.minusSeconds(60)).message("first").build());
    }
  }

  static class RecordingSink implements DeliverySink {
    final List<List<Long>> batches = new CopyOnWriteArrayList<>();
    final List<Long> channels = new CopyOnWriteArrayList<>();

    @Override
    public DeliveryResult deliver(DeliveryTarget target, List<ChannelEvent> events, String batchId) {
      channels.add(target.channelId());
      batches.add(events.stream().map(ChannelEvent::sequenceId).toList());
      return DeliveryResult.accepted(events.size(), 0);
    }
  }

  @Configuration
  static class SourceClientConfig {
    @Bean
    SourceClient sourceClient() {
      return new StubSourceClient();
    }
  }

  @Configuration
  static class RecordingSinkConfig {
    @Bean
    RecordingSink recordingSink() {
      return new RecordingSink();
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean("myWatermarkStore")
    AbstractJdbcWatermarkStore watermarkStore() {
      return new H2WatermarkStore();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
