package com.example.courtalert.model;

import java.time.Instant;
import java.util.List;

public record EngineStats(
    long totalCycles,
    long successfulCycles,
    long failedCycles,
    long notificationsSent,
    Instant lastCycleTime,
    int sourcesTracked,
    List<SourceHealth> sources) {

  public EngineStats {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
