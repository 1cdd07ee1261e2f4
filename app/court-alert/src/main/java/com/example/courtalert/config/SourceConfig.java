/*
 * Where: Court alert configuration
 * What: Builds the source registry from configured HTTP platforms and adapter beans
 * Why: The registry is constructed once at startup and injected where sources are needed
 */
package com.example.courtalert.config;

import com.example.courtalert.source.AvailabilitySource;
import com.example.courtalert.source.HttpAvailabilitySource;
import com.example.courtalert.source.SourceRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SourceConfig {

  private static final Logger logger = LoggerFactory.getLogger(SourceConfig.class);

  @Bean
  SourceRegistry sourceRegistry(
      SourceProperties properties,
      ObjectProvider<AvailabilitySource> adapterBeans,
      RestClient.Builder restClientBuilder,
      Clock clock) {
    final List<AvailabilitySource> sources = new ArrayList<>();
    adapterBeans.orderedStream().forEach(sources::add);
    for (SourceProperties.Source source : properties.sources()) {
      sources.add(new HttpAvailabilitySource(source, restClient(restClientBuilder, source), clock));
    }
    final SourceRegistry registry = new SourceRegistry(sources);
    logger.info("availability sources registered count={} ids={}", registry.size(), registry.sourceIds());
    return registry;
  }

  private RestClient restClient(RestClient.Builder builder, SourceProperties.Source source) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(source.connectTimeout());
    requestFactory.setReadTimeout(source.readTimeout());
    return builder.clone().baseUrl(source.baseUrl()).requestFactory(requestFactory).build();
  }
}
