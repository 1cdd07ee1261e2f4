/*
 * Where: Court alert detection layer
 * What: Diffs two captures of a source into OPENED and CLOSED transitions
 * Why: Only newly opened time triggers alerts, so unchanged availability must yield nothing
 */
package com.example.courtalert.detection;

import com.example.courtalert.model.Slot;
import com.example.courtalert.model.Snapshot;
import com.example.courtalert.model.TimeWindow;
import com.example.courtalert.model.TransitionEvent;
import com.example.courtalert.model.TransitionKind;
import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChangeDetector {

  private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

  private static final Comparator<TransitionEvent> EVENT_ORDER =
      Comparator.comparing(TransitionEvent::courtId)
          .thenComparing(event -> event.window().start())
          .thenComparing(TransitionEvent::kind);

  /**
   * Returns the transitions from {@code previous} to {@code current}, ordered by court, start and
   * kind. A missing previous capture yields no events; captures covering different dates or courts
   * are treated as a full replace.
   */
  public List<TransitionEvent> detect(Snapshot previous, Snapshot current) {
    if (previous == null) {
      return List.of();
    }
    final Instant detectedAt = current.capturedAt();
    final List<TransitionEvent> events = new ArrayList<>();
    if (!current.isComparableTo(previous)) {
      logger.info(
          "snapshots not comparable, treating as full replace sourceId={} previousRange={} currentRange={}",
          current.sourceId(),
          previous.dateRange(),
          current.dateRange());
      for (String courtId : current.courtIds()) {
        for (Slot slot : current.slots(courtId)) {
          if (slot.isOpen()) {
            events.add(event(current.sourceId(), courtId, slot.window(), TransitionKind.OPENED, detectedAt));
          }
        }
      }
      events.sort(EVENT_ORDER);
      return List.copyOf(events);
    }
    for (String courtId : current.courtIds()) {
      final List<TimeWindow> wasOpen = openWindows(previous.slots(courtId));
      final List<TimeWindow> isOpen = openWindows(current.slots(courtId));
      for (TimeWindow window : isOpen) {
        for (TimeWindow portion : subtract(window, wasOpen)) {
          events.add(event(current.sourceId(), courtId, portion, TransitionKind.OPENED, detectedAt));
        }
      }
      for (TimeWindow window : wasOpen) {
        for (TimeWindow portion : subtract(window, isOpen)) {
          events.add(event(current.sourceId(), courtId, portion, TransitionKind.CLOSED, detectedAt));
        }
      }
    }
    events.sort(EVENT_ORDER);
    return List.copyOf(events);
  }

  private static List<TimeWindow> openWindows(List<Slot> slots) {
    return slots.stream().filter(Slot::isOpen).map(Slot::window).toList();
  }

  /** Parts of {@code window} not covered by any of {@code covering}, which is sorted by start. */
  @VisibleForTesting
  static List<TimeWindow> subtract(TimeWindow window, List<TimeWindow> covering) {
    final List<TimeWindow> remaining = new ArrayList<>();
    Instant cursor = window.start();
    for (TimeWindow cover : covering) {
      if (!cover.end().isAfter(cursor)) {
        continue;
      }
      if (!cover.start().isBefore(window.end())) {
        break;
      }
      if (cover.start().isAfter(cursor)) {
        remaining.add(new TimeWindow(cursor, cover.start()));
      }
      cursor = cover.end();
      if (!cursor.isBefore(window.end())) {
        return remaining;
      }
    }
    remaining.add(new TimeWindow(cursor, window.end()));
    return remaining;
  }

  private static TransitionEvent event(
      String sourceId, String courtId, TimeWindow window, TransitionKind kind, Instant detectedAt) {
    return new TransitionEvent(sourceId, courtId, window, kind, detectedAt);
  }
}
