package com.example.courtalert.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record ConsolidatedWindow(String sourceId, String courtId, Instant start, Instant end) {

  public ConsolidatedWindow {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(courtId, "courtId");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException(
          "window start must be before end courtId=" + courtId + " start=" + start + " end=" + end);
    }
  }

  public static ConsolidatedWindow of(String sourceId, String courtId, TimeWindow window) {
    return new ConsolidatedWindow(sourceId, courtId, window.start(), window.end());
  }

  public TimeWindow window() {
    return new TimeWindow(start, end);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public boolean sameCourt(ConsolidatedWindow other) {
    return sourceId.equals(other.sourceId) && courtId.equals(other.courtId);
  }

  public boolean overlaps(ConsolidatedWindow other) {
    return sameCourt(other) && window().overlaps(other.window());
  }
}
