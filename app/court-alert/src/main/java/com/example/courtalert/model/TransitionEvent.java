package com.example.courtalert.model;

import java.time.Instant;

public record TransitionEvent(
    String sourceId, String courtId, TimeWindow window, TransitionKind kind, Instant detectedAt) {

  public boolean isOpened() {
    return kind == TransitionKind.OPENED;
  }
}
