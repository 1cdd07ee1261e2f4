/*
 * Where: Court alert gate
 * What: Decides which matches become digests, against the subscription's notification log
 * Why: A re-detected window or an exhausted daily quota must not reach the user again
 */
package com.example.courtalert.gate;

import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.Digest;
import com.example.courtalert.model.DigestEntry;
import com.example.courtalert.model.GateDecision;
import com.example.courtalert.model.NotificationRecord;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionMatch;
import com.example.courtalert.repository.NotificationRecordRepository;
import com.example.courtalert.service.EngineMetrics;
import com.example.courtalert.source.SourceRegistry;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationGate {

  private static final Logger logger = LoggerFactory.getLogger(NotificationGate.class);
  static final String REASON_DUPLICATE = "duplicate";
  static final String REASON_DAILY_CAP = "daily_cap";

  private final NotificationRecordRepository recordRepository;
  private final SourceRegistry sourceRegistry;
  private final EngineProperties engineProperties;
  private final EngineMetrics metrics;
  private final Clock clock;

  /** Evaluates one match on its own: duplicate window first, then the daily cap. */
  public GateDecision admit(SubscriptionMatch match) {
    final Instant now = Instant.now(clock);
    final Subscription subscription = match.subscription();
    final List<NotificationRecord> recent = recentRecords(subscription, now);
    if (isDuplicate(match.window(), subscription, recent, now)) {
      metrics.recordSuppressed(REASON_DUPLICATE);
      return GateDecision.SUPPRESS;
    }
    if (isCapReached(subscription, recent, now)) {
      metrics.recordSuppressed(REASON_DAILY_CAP);
      return GateDecision.SUPPRESS;
    }
    return GateDecision.SEND;
  }

  /**
   * Applies the policy to all matches of a cycle and coalesces the admitted windows of each
   * subscription into one digest. The cap is checked once per digest. Nothing is persisted here.
   */
  public List<Digest> gate(List<SubscriptionMatch> matches) {
    final Instant now = Instant.now(clock);
    final Map<String, List<SubscriptionMatch>> bySubscription = new LinkedHashMap<>();
    for (SubscriptionMatch match : matches) {
      bySubscription.computeIfAbsent(match.subscriptionId(), ignored -> new ArrayList<>()).add(match);
    }
    final List<Digest> digests = new ArrayList<>();
    for (List<SubscriptionMatch> subscriptionMatches : bySubscription.values()) {
      final Subscription subscription = subscriptionMatches.get(0).subscription();
      final List<NotificationRecord> recent = recentRecords(subscription, now);
      final List<DigestEntry> entries = new ArrayList<>();
      for (SubscriptionMatch match : subscriptionMatches) {
        if (isDuplicate(match.window(), subscription, recent, now)) {
          metrics.recordSuppressed(REASON_DUPLICATE);
          continue;
        }
        entries.add(new DigestEntry(match.window(), sourceRegistry.displayName(match.window().sourceId())));
      }
      if (entries.isEmpty()) {
        continue;
      }
      if (isCapReached(subscription, recent, now)) {
        metrics.recordSuppressed(REASON_DAILY_CAP);
        logger.info(
            "digest suppressed by daily cap subscriptionId={} windows={} cap={}",
            subscription.id(),
            entries.size(),
            subscription.maxNotificationsPerDay());
        continue;
      }
      digests.add(new Digest(UUID.randomUUID().toString(), subscription, entries));
    }
    return List.copyOf(digests);
  }

  /** Appends the log entry of a digest; called before the digest is handed to a dispatcher. */
  public NotificationRecord record(Digest digest) {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.fromString(digest.digestId()),
            digest.subscription().id(),
            Instant.now(clock),
            digest.windows());
    recordRepository.append(record);
    return record;
  }

  private List<NotificationRecord> recentRecords(Subscription subscription, Instant now) {
    final Instant frequencyStart = now.minus(subscription.notificationFrequency());
    final Instant dayStart = startOfDay(now);
    final Instant since = frequencyStart.isBefore(dayStart) ? frequencyStart : dayStart;
    return recordRepository.queryRecords(subscription.id(), since);
  }

  private boolean isDuplicate(
      ConsolidatedWindow candidate,
      Subscription subscription,
      List<NotificationRecord> recent,
      Instant now) {
    final Instant frequencyStart = now.minus(subscription.notificationFrequency());
    return recent.stream()
        .filter(record -> !record.sentAt().isBefore(frequencyStart))
        .anyMatch(record -> record.covers(candidate));
  }

  private boolean isCapReached(
      Subscription subscription, List<NotificationRecord> recent, Instant now) {
    final Instant dayStart = startOfDay(now);
    final long sentToday = recent.stream().filter(record -> !record.sentAt().isBefore(dayStart)).count();
    return sentToday >= subscription.maxNotificationsPerDay();
  }

  @VisibleForTesting
  Instant startOfDay(Instant now) {
    final ZoneId zone = engineProperties.timeZone();
    return LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
  }
}
