/*
 * Where: Court alert matcher tests
 * What: Verifies preference filters, minimum duration and the carried sub-window
 */
package com.example.courtalert.matching;

import static com.example.courtalert.support.Fixtures.TUESDAY;
import static com.example.courtalert.support.Fixtures.at;
import static com.example.courtalert.support.Fixtures.tuesdayMorning;
import static com.example.courtalert.support.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.PreferredTime;
import com.example.courtalert.model.SourcePreference;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionMatch;
import com.example.courtalert.model.SubscriptionStatus;
import com.example.courtalert.support.Fixtures;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SubscriptionMatcherTest {

  private static final LocalDate TODAY = LocalDate.parse("2026-10-18");

  private final SubscriptionMatcher matcher =
      new SubscriptionMatcher(new EngineProperties(true, null, ZoneId.of("UTC"), null));

  @Test
  void tuesdayWindowInsidePreferredRangeMatches() {
    final Subscription subscription = tuesdayMorning("sub-1");

    final List<SubscriptionMatch> matches =
        matcher.match(List.of(window("A1", "10:00", "11:00")), List.of(subscription), TODAY);

    assertThat(matches).containsExactly(new SubscriptionMatch(subscription, window("A1", "10:00", "11:00")));
  }

  @Test
  void shortEarlyWindowDoesNotMatch() {
    final List<SubscriptionMatch> matches =
        matcher.match(
            List.of(window("A1", "08:00", "08:30")), List.of(tuesdayMorning("sub-1")), TODAY);

    assertThat(matches).isEmpty();
  }

  @Test
  void matchCarriesOnlyTheOverlappingPart() {
    final List<SubscriptionMatch> matches =
        matcher.match(
            List.of(window("A1", "08:00", "12:30")), List.of(tuesdayMorning("sub-1")), TODAY);

    assertThat(matches).extracting(SubscriptionMatch::window).containsExactly(window("A1", "09:00", "12:00"));
  }

  @Test
  void partialOverlapShorterThanMinimumDoesNotMatch() {
    final List<SubscriptionMatch> matches =
        matcher.match(
            List.of(window("A1", "11:30", "13:00")), List.of(tuesdayMorning("sub-1")), TODAY);

    assertThat(matches).isEmpty();
  }

  @Test
  void pausedOrExpiredSubscriptionsNeverMatch() {
    final Subscription base = tuesdayMorning("sub-1");
    final Subscription paused = withStatus(base, SubscriptionStatus.PAUSED, null);
    final Subscription expired = withStatus(base, SubscriptionStatus.ACTIVE, TODAY.minusDays(1));
    final Subscription expiresToday = withStatus(base, SubscriptionStatus.ACTIVE, TODAY);

    final List<SubscriptionMatch> matches =
        matcher.match(
            List.of(window("A1", "10:00", "11:00")), List.of(paused, expired, expiresToday), TODAY);

    assertThat(matches).extracting(SubscriptionMatch::subscription).containsExactly(expiresToday);
  }

  @Test
  void courtAndSourcePreferencesFilterWindows() {
    final Subscription onlyA1 =
        new Subscription(
            "sub-a1",
            "owner",
            "a1@example.com",
            Set.of(new SourcePreference(Fixtures.SOURCE_ID, Set.of("A1"))),
            Set.of(new PreferredTime(DayOfWeek.TUESDAY, LocalTime.of(9, 0), LocalTime.of(12, 0))),
            60,
            null,
            3,
            24,
            SubscriptionStatus.ACTIVE);
    final ConsolidatedWindow otherSource =
        new ConsolidatedWindow("club-b", "A1", at("10:00"), at("11:00"));

    final List<SubscriptionMatch> matches =
        matcher.match(
            List.of(window("B2", "10:00", "11:00"), otherSource, window("A1", "10:00", "11:00")),
            List.of(onlyA1),
            TODAY);

    assertThat(matches).extracting(SubscriptionMatch::window).containsExactly(window("A1", "10:00", "11:00"));
  }

  @Test
  void identicalPairsFromSeveralPreferredTimesAreKeptOnce() {
    final Subscription subscription =
        new Subscription(
            "sub-1",
            "owner",
            "sub@example.com",
            Set.of(new SourcePreference(Fixtures.SOURCE_ID, Set.of())),
            Set.of(
                new PreferredTime(DayOfWeek.TUESDAY, LocalTime.of(9, 0), LocalTime.of(12, 0)),
                new PreferredTime(DayOfWeek.TUESDAY, LocalTime.of(10, 0), LocalTime.of(11, 0))),
            60,
            null,
            3,
            24,
            SubscriptionStatus.ACTIVE);

    final List<SubscriptionMatch> matches =
        matcher.match(List.of(window("A1", "10:00", "11:00")), List.of(subscription), TODAY);

    assertThat(matches).hasSize(1);
  }

  @Test
  void windowCrossingMidnightIsEvaluatedOnEachDate() {
    final Subscription earlyTuesday =
        new Subscription(
            "sub-night",
            "owner",
            "night@example.com",
            Set.of(new SourcePreference(Fixtures.SOURCE_ID, Set.of())),
            Set.of(new PreferredTime(DayOfWeek.TUESDAY, LocalTime.of(0, 0), LocalTime.of(1, 30))),
            60,
            null,
            3,
            24,
            SubscriptionStatus.ACTIVE);
    final ConsolidatedWindow overnight =
        new ConsolidatedWindow(
            Fixtures.SOURCE_ID,
            "A1",
            TUESDAY.minusDays(1).atTime(23, 0).toInstant(ZoneOffset.UTC),
            at("02:00"));

    final List<SubscriptionMatch> matches =
        matcher.match(List.of(overnight), List.of(earlyTuesday), TODAY);

    assertThat(matches).extracting(SubscriptionMatch::window).containsExactly(window("A1", "00:00", "01:30"));
  }

  @Test
  void preferredTimesAreReadInTheEngineZone() {
    final SubscriptionMatcher vilnius =
        new SubscriptionMatcher(new EngineProperties(true, null, ZoneId.of("Europe/Vilnius"), null));

    // 07:00-08:00 UTC is 10:00-11:00 in Vilnius on 2026-10-20 (UTC+3)
    final List<SubscriptionMatch> matches =
        vilnius.match(List.of(window("A1", "07:00", "08:00")), List.of(tuesdayMorning("sub-1")), TODAY);

    assertThat(matches).hasSize(1);
  }

  @Test
  void preferredRangeInsideSpringForwardGapIsSkippedWithoutAffectingOthers() {
    final SubscriptionMatcher vilnius =
        new SubscriptionMatcher(new EngineProperties(true, null, ZoneId.of("Europe/Vilnius"), null));
    // 2026-03-29 is a Sunday; Vilnius clocks jump from 03:00 to 04:00
    final Subscription inGap = sunday("sub-gap", LocalTime.of(3, 30), LocalTime.of(4, 0));
    final Subscription morning = sunday("sub-morning", LocalTime.of(10, 0), LocalTime.of(11, 0));
    final ConsolidatedWindow window =
        new ConsolidatedWindow(
            Fixtures.SOURCE_ID,
            "A1",
            Instant.parse("2026-03-29T07:00:00Z"),
            Instant.parse("2026-03-29T09:00:00Z"));

    final List<SubscriptionMatch> matches =
        vilnius.match(List.of(window), List.of(inGap, morning), TODAY);

    assertThat(matches)
        .containsExactly(
            new SubscriptionMatch(
                morning,
                new ConsolidatedWindow(
                    Fixtures.SOURCE_ID,
                    "A1",
                    Instant.parse("2026-03-29T07:00:00Z"),
                    Instant.parse("2026-03-29T08:00:00Z"))));
  }

  @Test
  void everyMatchMeetsTheMinimumDuration() {
    final Subscription subscription = tuesdayMorning("sub-1");
    final List<ConsolidatedWindow> windows =
        List.of(
            window("A1", "08:00", "09:30"),
            window("A2", "09:30", "10:15"),
            window("A3", "11:00", "13:00"),
            window("A4", "08:00", "12:00"));

    final List<SubscriptionMatch> matches = matcher.match(windows, List.of(subscription), TODAY);

    assertThat(matches)
        .allSatisfy(match -> assertThat(match.window().duration()).isGreaterThanOrEqualTo(Duration.ofMinutes(60)));
    assertThat(matches).extracting(match -> match.window().courtId()).containsExactly("A3", "A4");
  }

  private static Subscription sunday(String id, LocalTime start, LocalTime end) {
    return new Subscription(
        id,
        "owner-" + id,
        id + "@example.com",
        Set.of(new SourcePreference(Fixtures.SOURCE_ID, Set.of())),
        Set.of(new PreferredTime(DayOfWeek.SUNDAY, start, end)),
        30,
        null,
        3,
        24,
        SubscriptionStatus.ACTIVE);
  }

  private static Subscription withStatus(
      Subscription base, SubscriptionStatus status, LocalDate expiryDate) {
    return new Subscription(
        base.id() + "-" + status + "-" + expiryDate,
        base.ownerId(),
        base.recipient(),
        base.sourcePreferences(),
        base.preferredTimes(),
        base.minSlotDurationMinutes(),
        expiryDate,
        base.maxNotificationsPerDay(),
        base.notificationFrequencyHours(),
        status);
  }
}
