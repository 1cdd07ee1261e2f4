package com.example.courtalert.source.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SourceSnapshotResponse(
    String sourceId, Instant capturedAt, LocalDate dateFrom, LocalDate dateTo, List<CourtPayload> courts) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CourtPayload(String courtId, String courtName, List<SlotPayload> slots) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SlotPayload(Instant start, Instant end, String status) {}
}
