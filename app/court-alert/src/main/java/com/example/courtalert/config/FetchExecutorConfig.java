package com.example.courtalert.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FetchExecutorConfig {

  // shut down by AvailabilityEngine.stop() within the configured grace
  @Bean(destroyMethod = "")
  public ExecutorService snapshotFetchExecutor(CacheProperties cacheProperties) {
    return Executors.newFixedThreadPool(
        cacheProperties.maxConcurrentFetches(),
        new ThreadFactoryBuilder().setNameFormat("snapshot-fetch-%d").setDaemon(true).build());
  }
}
