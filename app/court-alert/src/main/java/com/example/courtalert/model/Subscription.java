/*
 * Where: Court alert domain model
 * What: A user's standing interest filter with its notification limits
 * Why: Owned by the subscription store, read by the matcher and the gate
 */
package com.example.courtalert.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Set;

public record Subscription(
    String id,
    String ownerId,
    String recipient,
    Set<SourcePreference> sourcePreferences,
    Set<PreferredTime> preferredTimes,
    int minSlotDurationMinutes,
    LocalDate expiryDate,
    int maxNotificationsPerDay,
    int notificationFrequencyHours,
    SubscriptionStatus status) {

  public static final int DEFAULT_MIN_SLOT_DURATION_MINUTES = 60;
  public static final int DEFAULT_MAX_NOTIFICATIONS_PER_DAY = 3;
  public static final int DEFAULT_NOTIFICATION_FREQUENCY_HOURS = 24;

  public Subscription {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("subscription id is required");
    }
    sourcePreferences = sourcePreferences == null ? Set.of() : Set.copyOf(sourcePreferences);
    preferredTimes = preferredTimes == null ? Set.of() : Set.copyOf(preferredTimes);
    minSlotDurationMinutes =
        minSlotDurationMinutes <= 0 ? DEFAULT_MIN_SLOT_DURATION_MINUTES : minSlotDurationMinutes;
    maxNotificationsPerDay =
        maxNotificationsPerDay <= 0 ? DEFAULT_MAX_NOTIFICATIONS_PER_DAY : maxNotificationsPerDay;
    notificationFrequencyHours =
        notificationFrequencyHours <= 0
            ? DEFAULT_NOTIFICATION_FREQUENCY_HOURS
            : notificationFrequencyHours;
    status = status == null ? SubscriptionStatus.ACTIVE : status;
  }

  public boolean isActiveOn(LocalDate today) {
    return status == SubscriptionStatus.ACTIVE && (expiryDate == null || !expiryDate.isBefore(today));
  }

  public Duration minSlotDuration() {
    return Duration.ofMinutes(minSlotDurationMinutes);
  }

  public Duration notificationFrequency() {
    return Duration.ofHours(notificationFrequencyHours);
  }

  public boolean watches(String sourceId, String courtId) {
    return sourcePreferences.stream().anyMatch(pref -> pref.matches(sourceId, courtId));
  }
}
