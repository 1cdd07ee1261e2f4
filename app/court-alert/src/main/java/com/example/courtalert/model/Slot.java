/*
 * Where: Court alert domain model
 * What: One bookable slot of a court within a snapshot
 */
package com.example.courtalert.model;

import java.time.Instant;
import java.util.Objects;

public record Slot(String courtId, Instant start, Instant end, SlotStatus status) {

  public Slot {
    if (courtId == null || courtId.isBlank()) {
      throw new IllegalArgumentException("courtId is required");
    }
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException(
          "slot start must be before end courtId=" + courtId + " start=" + start + " end=" + end);
    }
    status = status == null ? SlotStatus.UNKNOWN : status;
  }

  public TimeWindow window() {
    return new TimeWindow(start, end);
  }

  public boolean isOpen() {
    return status == SlotStatus.OPEN;
  }
}
