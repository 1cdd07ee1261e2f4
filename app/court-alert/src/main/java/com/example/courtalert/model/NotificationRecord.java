package com.example.courtalert.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record NotificationRecord(
    UUID recordId, String subscriptionId, Instant sentAt, List<ConsolidatedWindow> coveredWindows) {

  public NotificationRecord {
    coveredWindows = coveredWindows == null ? List.of() : List.copyOf(coveredWindows);
  }

  public boolean covers(ConsolidatedWindow candidate) {
    return coveredWindows.stream().anyMatch(covered -> covered.overlaps(candidate));
  }
}
