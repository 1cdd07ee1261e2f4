/*
 * Where: Court alert matching layer
 * What: Pairs consolidated windows with the subscriptions they satisfy
 * Why: Preferences are local wall-clock times, so weekdays and ranges are evaluated in the engine zone
 */
package com.example.courtalert.matching;

import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.PreferredTime;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionMatch;
import com.example.courtalert.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionMatcher {

  private static final Comparator<PreferredTime> PREFERRED_TIME_ORDER =
      Comparator.comparing(PreferredTime::dayOfWeek)
          .thenComparing(PreferredTime::startTime)
          .thenComparing(PreferredTime::endTime);

  private final EngineProperties engineProperties;

  /**
   * Returns one match per satisfied preferred-time entry, carrying the overlapping part of the
   * window. Identical pairs are kept once, in first-seen order.
   */
  public List<SubscriptionMatch> match(
      List<ConsolidatedWindow> windows, List<Subscription> subscriptions, LocalDate today) {
    final ZoneId zone = engineProperties.timeZone();
    final Set<SubscriptionMatch> matches = new LinkedHashSet<>();
    for (Subscription subscription : subscriptions) {
      if (!subscription.isActiveOn(today)) {
        continue;
      }
      final List<PreferredTime> preferredTimes = new ArrayList<>(subscription.preferredTimes());
      preferredTimes.sort(PREFERRED_TIME_ORDER);
      for (ConsolidatedWindow window : windows) {
        if (!subscription.watches(window.sourceId(), window.courtId())) {
          continue;
        }
        final Duration minimum = subscription.minSlotDuration();
        if (window.duration().compareTo(minimum) < 0) {
          continue;
        }
        for (PreferredTime preferredTime : preferredTimes) {
          for (TimeWindow overlap : overlaps(window, preferredTime, zone)) {
            if (overlap.duration().compareTo(minimum) >= 0) {
              matches.add(
                  new SubscriptionMatch(
                      subscription,
                      ConsolidatedWindow.of(window.sourceId(), window.courtId(), overlap)));
            }
          }
        }
      }
    }
    return List.copyOf(matches);
  }

  /** Intersections of the window with the preferred range on every local date it touches. */
  private static List<TimeWindow> overlaps(
      ConsolidatedWindow window, PreferredTime preferredTime, ZoneId zone) {
    final List<TimeWindow> result = new ArrayList<>();
    final LocalDate first = window.start().atZone(zone).toLocalDate();
    final LocalDate last = window.end().minusNanos(1).atZone(zone).toLocalDate();
    for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
      if (date.getDayOfWeek() != preferredTime.dayOfWeek()) {
        continue;
      }
      final Instant from = date.atTime(preferredTime.startTime()).atZone(zone).toInstant();
      final Instant to = date.atTime(preferredTime.endTime()).atZone(zone).toInstant();
      // a range inside a spring-forward gap collapses to nothing on that date
      if (!from.isBefore(to)) {
        continue;
      }
      final Optional<TimeWindow> overlap = window.window().intersect(new TimeWindow(from, to));
      overlap.ifPresent(result::add);
    }
    return result;
  }
}
