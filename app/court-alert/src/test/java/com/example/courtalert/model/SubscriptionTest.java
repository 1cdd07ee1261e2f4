package com.example.courtalert.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SubscriptionTest {

  @Test
  void unsetLimitsFallBackToDefaults() {
    final Subscription subscription =
        new Subscription("sub-1", "owner", null, null, null, 0, null, 0, 0, null);

    assertThat(subscription.minSlotDuration()).isEqualTo(Duration.ofMinutes(60));
    assertThat(subscription.maxNotificationsPerDay()).isEqualTo(3);
    assertThat(subscription.notificationFrequency()).isEqualTo(Duration.ofHours(24));
    assertThat(subscription.status()).isEqualTo(SubscriptionStatus.ACTIVE);
  }

  @Test
  void expiryDateIsInclusive() {
    final LocalDate expiry = LocalDate.parse("2026-10-20");
    final Subscription subscription =
        new Subscription("sub-1", "owner", null, null, null, 60, expiry, 3, 24, SubscriptionStatus.ACTIVE);

    assertThat(subscription.isActiveOn(expiry)).isTrue();
    assertThat(subscription.isActiveOn(expiry.plusDays(1))).isFalse();
  }

  @Test
  void emptyCourtSetWatchesEveryCourtOfTheSource() {
    final Subscription subscription =
        new Subscription(
            "sub-1",
            "owner",
            null,
            Set.of(new SourcePreference("club-a", Set.of()), new SourcePreference("club-b", Set.of("B1"))),
            null,
            60,
            null,
            3,
            24,
            SubscriptionStatus.ACTIVE);

    assertThat(subscription.watches("club-a", "anything")).isTrue();
    assertThat(subscription.watches("club-b", "B1")).isTrue();
    assertThat(subscription.watches("club-b", "B2")).isFalse();
    assertThat(subscription.watches("club-c", "B1")).isFalse();
  }

  @Test
  void blankIdIsRejected() {
    assertThatThrownBy(() -> new Subscription(" ", "owner", null, null, null, 60, null, 3, 24, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
