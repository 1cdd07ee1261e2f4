/*
 * Where: Court alert configuration binding
 * What: Holds the engine cadence, the zone for calendar rules and the shutdown grace
 * Why: The polling cadence differs per deployment and must not be a constant
 */
package com.example.courtalert.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "court-alert.engine")
@Validated
public record EngineProperties(
    boolean workerEnabled, Duration pollInterval, ZoneId timeZone, Duration shutdownGrace) {

  public EngineProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(60) : pollInterval;
    timeZone = timeZone == null ? ZoneId.of("UTC") : timeZone;
    shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
  }

  @AssertTrue(message = "court-alert.engine.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return !pollInterval.isZero() && !pollInterval.isNegative();
  }
}
