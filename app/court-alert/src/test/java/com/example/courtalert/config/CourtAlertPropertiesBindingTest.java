/*
 * Where: Court alert configuration binding tests
 * What: Duration, zone and list binding of the court-alert.* records
 */
package com.example.courtalert.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class CourtAlertPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDurationsZoneAndSources() {
    contextRunner
        .withPropertyValues(
            "court-alert.engine.poll-interval=30s",
            "court-alert.engine.time-zone=Europe/Vilnius",
            "court-alert.engine.shutdown-grace=5s",
            "court-alert.engine.lease.mode=jdbc",
            "court-alert.engine.lease.ttl=2m",
            "court-alert.cache.fetch-days=14",
            "court-alert.cache.fetch-timeout=3s",
            "court-alert.consolidation.max-gap=15m",
            "court-alert.dispatch.from=alerts@example.com",
            "court-alert.sources[0].id=club-a",
            "court-alert.sources[0].base-url=https://club-a.example.com",
            "court-alert.sources[0].read-timeout=2s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final EngineProperties engine = context.getBean(EngineProperties.class);
              final LeaseProperties lease = context.getBean(LeaseProperties.class);
              final CacheProperties cache = context.getBean(CacheProperties.class);
              final SourceProperties sources = context.getBean(SourceProperties.class);

              assertThat(engine.pollInterval()).isEqualTo(Duration.ofSeconds(30));
              assertThat(engine.timeZone()).isEqualTo(ZoneId.of("Europe/Vilnius"));
              assertThat(engine.shutdownGrace()).isEqualTo(Duration.ofSeconds(5));
              assertThat(lease.mode()).isEqualTo(LeaseProperties.MODE_JDBC);
              assertThat(lease.ttl()).isEqualTo(Duration.ofMinutes(2));
              assertThat(cache.fetchDays()).isEqualTo(14);
              assertThat(cache.maxConcurrentFetches()).isEqualTo(CacheProperties.DEFAULT_MAX_CONCURRENT_FETCHES);
              assertThat(cache.fetchTimeout()).isEqualTo(Duration.ofSeconds(3));
              assertThat(context.getBean(ConsolidationProperties.class).maxGap())
                  .isEqualTo(Duration.ofMinutes(15));
              assertThat(context.getBean(DispatchProperties.class).mode())
                  .isEqualTo(DispatchProperties.MODE_LOCAL);
              assertThat(sources.sources())
                  .singleElement()
                  .satisfies(
                      source -> {
                        assertThat(source.displayName()).isEqualTo("club-a");
                        assertThat(source.readTimeout()).isEqualTo(Duration.ofSeconds(2));
                        assertThat(source.snapshotPath()).contains("{from}");
                      });
            });
  }

  @Test
  void defaultsApplyWithoutProperties() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(EngineProperties.class).pollInterval())
              .isEqualTo(Duration.ofSeconds(60));
          assertThat(context.getBean(LeaseProperties.class).mode()).isEqualTo(LeaseProperties.MODE_LOCAL);
          assertThat(context.getBean(SourceProperties.class).sources()).isEmpty();
        });
  }

  @Test
  void rejectsNonPositiveFetchTimeout() {
    contextRunner
        .withPropertyValues("court-alert.cache.fetch-timeout=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsNegativeConsolidationGap() {
    contextRunner
        .withPropertyValues("court-alert.consolidation.max-gap=-5m")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsSourceWithoutBaseUrl() {
    contextRunner
        .withPropertyValues("court-alert.sources[0].id=club-a")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    EngineProperties.class,
    LeaseProperties.class,
    CacheProperties.class,
    ConsolidationProperties.class,
    DispatchProperties.class,
    SourceProperties.class
  })
  static class TestConfiguration {}
}
