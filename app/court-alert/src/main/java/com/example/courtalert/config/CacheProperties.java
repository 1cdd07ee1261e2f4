/*
 * Where: Court alert configuration binding
 * What: Holds snapshot fetch horizon, fetch pool bound, per-call timeout and staleness age
 */
package com.example.courtalert.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "court-alert.cache")
@Validated
public record CacheProperties(
    @Positive int fetchDays,
    @Positive int maxConcurrentFetches,
    Duration fetchTimeout,
    Duration staleAfter) {

  public static final int DEFAULT_FETCH_DAYS = 8;
  public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 4;

  public CacheProperties {
    fetchDays = fetchDays == 0 ? DEFAULT_FETCH_DAYS : fetchDays;
    maxConcurrentFetches =
        maxConcurrentFetches == 0 ? DEFAULT_MAX_CONCURRENT_FETCHES : maxConcurrentFetches;
    fetchTimeout = fetchTimeout == null ? Duration.ofSeconds(20) : fetchTimeout;
    staleAfter = staleAfter == null ? Duration.ofMinutes(5) : staleAfter;
  }

  @AssertTrue(message = "court-alert.cache.fetch-timeout must be positive")
  public boolean isFetchTimeoutPositive() {
    return isPositiveDuration(fetchTimeout);
  }

  @AssertTrue(message = "court-alert.cache.stale-after must be positive")
  public boolean isStaleAfterPositive() {
    return isPositiveDuration(staleAfter);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
