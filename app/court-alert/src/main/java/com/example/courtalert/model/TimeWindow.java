/*
 * Where: Court alert domain model
 * What: Half-open time interval [start, end)
 * Why: Detection, consolidation, matching and dedup all compare intervals the same way
 */
package com.example.courtalert.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("window start must be before end start=" + start + " end=" + end);
    }
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public boolean overlaps(TimeWindow other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  public boolean touches(TimeWindow other) {
    return start.equals(other.end) || end.equals(other.start);
  }

  public Optional<TimeWindow> intersect(TimeWindow other) {
    final Instant from = start.isAfter(other.start) ? start : other.start;
    final Instant to = end.isBefore(other.end) ? end : other.end;
    if (!from.isBefore(to)) {
      return Optional.empty();
    }
    return Optional.of(new TimeWindow(from, to));
  }
}
