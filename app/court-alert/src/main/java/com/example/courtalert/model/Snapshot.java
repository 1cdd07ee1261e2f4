/*
 * Where: Court alert domain model
 * What: Immutable availability grid of one source captured at one instant
 * Why: Readers and the change detector share snapshots without locking
 */
package com.example.courtalert.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

public record Snapshot(
    String sourceId, Instant capturedAt, DateRange dateRange, Map<String, List<Slot>> slotsByCourt) {

  public Snapshot {
    if (sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("sourceId is required");
    }
    Objects.requireNonNull(capturedAt, "capturedAt");
    Objects.requireNonNull(dateRange, "dateRange");
    // court order is the detector's tie-break, so keep keys sorted
    final TreeMap<String, List<Slot>> copy = new TreeMap<>();
    if (slotsByCourt != null) {
      slotsByCourt.forEach(
          (courtId, slots) -> {
            final List<Slot> sorted = new ArrayList<>(slots == null ? List.of() : slots);
            sorted.sort(Comparator.comparing(Slot::start).thenComparing(Slot::end));
            copy.put(courtId, Collections.unmodifiableList(sorted));
          });
    }
    slotsByCourt = Collections.unmodifiableMap(copy);
  }

  public Set<String> courtIds() {
    return slotsByCourt.keySet();
  }

  public List<Slot> slots(String courtId) {
    return slotsByCourt.getOrDefault(courtId, List.of());
  }

  public boolean hasCourt(String courtId) {
    return slotsByCourt.containsKey(courtId);
  }

  /** Same source, same date range and same court set; otherwise a diff degrades to full replace. */
  public boolean isComparableTo(Snapshot other) {
    return other != null
        && sourceId.equals(other.sourceId)
        && dateRange.equals(other.dateRange)
        && courtIds().equals(other.courtIds());
  }

  public long openSlotCount() {
    return slotsByCourt.values().stream().flatMap(List::stream).filter(Slot::isOpen).count();
  }

  public int slotCount() {
    return slotsByCourt.values().stream().mapToInt(List::size).sum();
  }
}
