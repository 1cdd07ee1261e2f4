package com.example.courtalert.detection;

import com.example.courtalert.config.ConsolidationProperties;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.TransitionEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SlotConsolidator {

  private final ConsolidationProperties properties;

  /** Only OPENED events contribute; output is ordered by source, court and start. */
  public List<ConsolidatedWindow> consolidate(List<TransitionEvent> events) {
    final Duration maxGap = properties.maxGap();
    final Map<String, Map<String, List<TransitionEvent>>> grouped = new TreeMap<>();
    for (TransitionEvent event : events) {
      if (!event.isOpened()) {
        continue;
      }
      grouped
          .computeIfAbsent(event.sourceId(), ignored -> new TreeMap<>())
          .computeIfAbsent(event.courtId(), ignored -> new ArrayList<>())
          .add(event);
    }
    final List<ConsolidatedWindow> windows = new ArrayList<>();
    grouped.forEach(
        (sourceId, byCourt) ->
            byCourt.forEach((courtId, courtEvents) -> sweep(sourceId, courtId, courtEvents, maxGap, windows)));
    return List.copyOf(windows);
  }

  private void sweep(
      String sourceId,
      String courtId,
      List<TransitionEvent> courtEvents,
      Duration maxGap,
      List<ConsolidatedWindow> out) {
    courtEvents.sort(Comparator.comparing((TransitionEvent event) -> event.window().start()));
    Instant start = null;
    Instant end = null;
    for (TransitionEvent event : courtEvents) {
      final Instant nextStart = event.window().start();
      final Instant nextEnd = event.window().end();
      if (start == null) {
        start = nextStart;
        end = nextEnd;
      } else if (!nextStart.isAfter(end.plus(maxGap))) {
        if (nextEnd.isAfter(end)) {
          end = nextEnd;
        }
      } else {
        out.add(new ConsolidatedWindow(sourceId, courtId, start, end));
        start = nextStart;
        end = nextEnd;
      }
    }
    if (start != null) {
      out.add(new ConsolidatedWindow(sourceId, courtId, start, end));
    }
  }
}
