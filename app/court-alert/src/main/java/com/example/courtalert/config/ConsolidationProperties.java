package com.example.courtalert.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "court-alert.consolidation")
@Validated
public record ConsolidationProperties(Duration maxGap) {

  public ConsolidationProperties {
    maxGap = maxGap == null ? Duration.ZERO : maxGap;
  }

  @AssertTrue(message = "court-alert.consolidation.max-gap must not be negative")
  public boolean isMaxGapNotNegative() {
    return !maxGap.isNegative();
  }
}
