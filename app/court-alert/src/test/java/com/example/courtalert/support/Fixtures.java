/*
 * Where: Court alert test support
 * What: Builders for slots, snapshots, windows and subscriptions used across tests
 */
package com.example.courtalert.support;

import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.DateRange;
import com.example.courtalert.model.PreferredTime;
import com.example.courtalert.model.Slot;
import com.example.courtalert.model.SlotStatus;
import com.example.courtalert.model.Snapshot;
import com.example.courtalert.model.SourcePreference;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionStatus;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Fixtures {

  public static final String SOURCE_ID = "club-a";
  // 2026-10-20 is a Tuesday
  public static final LocalDate TUESDAY = LocalDate.parse("2026-10-20");
  public static final DateRange RANGE = DateRange.startingAt(LocalDate.parse("2026-10-19"), 8);

  private Fixtures() {}

  /** Instant on the Tuesday fixture date, UTC, from an "HH:mm" string. */
  public static Instant at(String time) {
    return TUESDAY.atTime(LocalTime.parse(time)).toInstant(ZoneOffset.UTC);
  }

  public static Slot open(String courtId, String start, String end) {
    return new Slot(courtId, at(start), at(end), SlotStatus.OPEN);
  }

  public static Slot booked(String courtId, String start, String end) {
    return new Slot(courtId, at(start), at(end), SlotStatus.BOOKED);
  }

  public static Snapshot snapshot(Instant capturedAt, Slot... slots) {
    return snapshot(SOURCE_ID, capturedAt, RANGE, slots);
  }

  public static Snapshot snapshot(String sourceId, Instant capturedAt, DateRange range, Slot... slots) {
    final Map<String, List<Slot>> byCourt = new LinkedHashMap<>();
    for (Slot slot : slots) {
      byCourt.computeIfAbsent(slot.courtId(), ignored -> new ArrayList<>()).add(slot);
    }
    return new Snapshot(sourceId, capturedAt, range, byCourt);
  }

  public static ConsolidatedWindow window(String courtId, String start, String end) {
    return new ConsolidatedWindow(SOURCE_ID, courtId, at(start), at(end));
  }

  public static Subscription tuesdayMorning(String id) {
    return subscription(id, 60, 3, 24);
  }

  public static Subscription subscription(
      String id, int minDurationMinutes, int maxPerDay, int frequencyHours) {
    return new Subscription(
        id,
        "owner-" + id,
        id + "@example.com",
        Set.of(new SourcePreference(SOURCE_ID, Set.of())),
        Set.of(new PreferredTime(DayOfWeek.TUESDAY, LocalTime.of(9, 0), LocalTime.of(12, 0))),
        minDurationMinutes,
        null,
        maxPerDay,
        frequencyHours,
        SubscriptionStatus.ACTIVE);
  }
}
