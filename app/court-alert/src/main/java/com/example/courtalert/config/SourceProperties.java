/*
 * Where: Court alert configuration binding
 * What: Lists the booking platforms polled over HTTP
 * Why: Each entry becomes one registered availability source at startup
 */
package com.example.courtalert.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "court-alert")
public record SourceProperties(List<Source> sources) {

  public SourceProperties {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public record Source(
      String id,
      String displayName,
      String baseUrl,
      String snapshotPath,
      Duration connectTimeout,
      Duration readTimeout) {

    public Source {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("court-alert.sources[].id is required");
      }
      if (baseUrl == null || baseUrl.isBlank()) {
        throw new IllegalArgumentException("court-alert.sources[].base-url is required id=" + id);
      }
      displayName = displayName == null || displayName.isBlank() ? id : displayName;
      snapshotPath =
          snapshotPath == null || snapshotPath.isBlank()
              ? "/v1/availability?from={from}&to={to}"
              : snapshotPath;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
    }
  }
}
