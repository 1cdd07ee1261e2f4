/*
 * Where: Court alert domain model
 * What: Refresh outcome history of one source
 * Why: Per-source failures are reported through engine stats instead of aborting cycles
 */
package com.example.courtalert.model;

import java.time.Instant;

public record SourceHealth(
    String sourceId,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String lastError,
    int consecutiveFailures,
    boolean flaggedForReview) {

  public static SourceHealth initial(String sourceId) {
    return new SourceHealth(sourceId, null, null, null, 0, false);
  }

  public SourceHealth succeeded(Instant at) {
    return new SourceHealth(sourceId, at, lastFailureAt, lastError, 0, flaggedForReview);
  }

  public SourceHealth failed(Instant at, String error, boolean inconsistent) {
    return new SourceHealth(
        sourceId, lastSuccessAt, at, error, consecutiveFailures + 1, flaggedForReview || inconsistent);
  }

  public boolean lastAttemptFailed() {
    return consecutiveFailures > 0;
  }
}
