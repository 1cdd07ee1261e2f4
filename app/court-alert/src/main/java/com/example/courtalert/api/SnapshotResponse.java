package com.example.courtalert.api;

import com.example.courtalert.model.CachedSnapshot;
import com.example.courtalert.model.Slot;
import com.example.courtalert.model.SlotStatus;
import com.example.courtalert.model.Snapshot;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record SnapshotResponse(
    String sourceId,
    Instant capturedAt,
    LocalDate dateFrom,
    LocalDate dateTo,
    boolean stale,
    Instant lastRefreshedAt,
    List<CourtView> courts) {

  public static SnapshotResponse from(CachedSnapshot cached) {
    final Snapshot snapshot = cached.snapshot();
    final List<CourtView> courts =
        snapshot.courtIds().stream()
            .map(
                courtId ->
                    new CourtView(
                        courtId,
                        snapshot.slots(courtId).stream().map(SlotView::from).toList()))
            .toList();
    return new SnapshotResponse(
        snapshot.sourceId(),
        snapshot.capturedAt(),
        snapshot.dateRange().from(),
        snapshot.dateRange().to(),
        cached.stale(),
        cached.lastRefreshedAt(),
        courts);
  }

  public record CourtView(String courtId, List<SlotView> slots) {}

  public record SlotView(Instant start, Instant end, SlotStatus status) {

    static SlotView from(Slot slot) {
      return new SlotView(slot.start(), slot.end(), slot.status());
    }
  }
}
