/*
 * Where: Court alert domain model
 * What: Outcome of one refresh-detect-match-gate-dispatch cycle
 */
package com.example.courtalert.model;

import java.time.Instant;

public record CycleReport(
    String cycleId,
    Instant startedAt,
    Instant finishedAt,
    int sourcesRefreshed,
    int sourcesFailed,
    int transitions,
    int windows,
    int matches,
    int digestsSent,
    int digestsFailed,
    boolean skipped) {

  public static CycleReport skipped(String cycleId, Instant at) {
    return new CycleReport(cycleId, at, at, 0, 0, 0, 0, 0, 0, 0, true);
  }

  public boolean succeeded() {
    return !skipped && sourcesFailed == 0;
  }
}
