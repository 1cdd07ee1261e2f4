/*
 * Where: Court alert service layer
 * What: Runs the refresh, detect, match, gate and dispatch cycle and keeps engine statistics
 * Why: One writer settles each cycle completely before the next one starts
 */
package com.example.courtalert.service;

import com.example.common.TraceIds;
import com.example.courtalert.cache.RefreshOutcome;
import com.example.courtalert.cache.SnapshotCache;
import com.example.courtalert.cache.SnapshotRefresher;
import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.config.LeaseProperties;
import com.example.courtalert.detection.ChangeDetector;
import com.example.courtalert.detection.SlotConsolidator;
import com.example.courtalert.dispatch.DigestDispatcher;
import com.example.courtalert.dispatch.DispatchException;
import com.example.courtalert.gate.NotificationGate;
import com.example.courtalert.lease.CycleLease;
import com.example.courtalert.matching.SubscriptionMatcher;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.CycleReport;
import com.example.courtalert.model.Digest;
import com.example.courtalert.model.EngineStats;
import com.example.courtalert.model.SnapshotPair;
import com.example.courtalert.model.SourceHealth;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionMatch;
import com.example.courtalert.model.TransitionEvent;
import com.example.courtalert.model.TransitionKind;
import com.example.courtalert.repository.SubscriptionRepository;
import com.example.courtalert.source.SourceRegistry;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AvailabilityEngine implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(AvailabilityEngine.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String MDC_CYCLE_ID = "cycle_id";

  private final SourceRegistry sourceRegistry;
  private final SnapshotRefresher refresher;
  private final SnapshotCache cache;
  private final ChangeDetector detector;
  private final SlotConsolidator consolidator;
  private final SubscriptionMatcher matcher;
  private final NotificationGate gate;
  private final SubscriptionRepository subscriptionRepository;
  private final DigestDispatcher dispatcher;
  private final CycleLease cycleLease;
  private final LeaseProperties leaseProperties;
  private final EngineProperties engineProperties;
  private final ExecutorService snapshotFetchExecutor;
  private final EngineMetrics metrics;
  private final Clock clock;

  private final ReentrantLock cycleLock = new ReentrantLock();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final AtomicLong totalCycles = new AtomicLong();
  private final AtomicLong successfulCycles = new AtomicLong();
  private final AtomicLong failedCycles = new AtomicLong();
  private final AtomicLong notificationsSent = new AtomicLong();
  private final AtomicReference<Instant> lastCycleTime = new AtomicReference<>();
  private final AtomicReference<String> holderId = new AtomicReference<>();

  /** Scheduled entry point; skips quietly when a manual cycle is still running. */
  public CycleReport runCycle() {
    if (!cycleLock.tryLock()) {
      logger.info("engine cycle skipped, previous cycle still running");
      return CycleReport.skipped(TraceIds.newTraceId(), Instant.now(clock));
    }
    try {
      return executeCycle();
    } finally {
      cycleLock.unlock();
    }
  }

  /**
   * Runs one cycle synchronously on the caller's thread.
   *
   * @throws CycleInProgressException when another cycle is running
   */
  public CycleReport triggerManualCycle() {
    if (!cycleLock.tryLock()) {
      throw new CycleInProgressException();
    }
    try {
      logger.info("manual engine cycle requested");
      return executeCycle();
    } finally {
      cycleLock.unlock();
    }
  }

  public EngineStats getEngineStats() {
    final List<SourceHealth> health = new ArrayList<>();
    for (String sourceId : sourceRegistry.sourceIds()) {
      health.add(cache.health(sourceId).orElse(SourceHealth.initial(sourceId)));
    }
    return new EngineStats(
        totalCycles.get(),
        successfulCycles.get(),
        failedCycles.get(),
        notificationsSent.get(),
        lastCycleTime.get(),
        cache.sourcesCached(),
        health);
  }

  private CycleReport executeCycle() {
    final String cycleId = TraceIds.newTraceId();
    final Instant startedAt = Instant.now(clock);
    MDC.put(MDC_CYCLE_ID, TraceIds.shortId(cycleId));
    try {
      if (stopping.get()) {
        logger.info("engine cycle skipped, engine is stopping");
        return CycleReport.skipped(cycleId, startedAt);
      }
      final String holder = holderId();
      if (!cycleLease.tryAcquire(holder, startedAt, startedAt.plus(leaseProperties.ttl()))) {
        logger.info("engine cycle skipped, lease held elsewhere lease={}", leaseProperties.name());
        return CycleReport.skipped(cycleId, startedAt);
      }
      try {
        return completeCycle(cycleId, startedAt);
      } catch (RuntimeException ex) {
        totalCycles.incrementAndGet();
        failedCycles.incrementAndGet();
        metrics.recordCycle("failed", Duration.between(startedAt, Instant.now(clock)));
        throw ex;
      } finally {
        lastCycleTime.set(startedAt);
      }
    } finally {
      MDC.remove(MDC_CYCLE_ID);
    }
  }

  private CycleReport completeCycle(String cycleId, Instant startedAt) {
    final LocalDate today = LocalDate.ofInstant(startedAt, engineProperties.timeZone());
    final int expired = subscriptionRepository.expireOverdue(today);
    if (expired > 0) {
      logger.info("subscriptions expired count={} today={}", expired, today);
    }

    final Map<String, RefreshOutcome> outcomes = refresher.refreshAll(sourceRegistry.sourceIds());
    int sourcesRefreshed = 0;
    int sourcesFailed = 0;
    int transitions = 0;
    final List<ConsolidatedWindow> windows = new ArrayList<>();
    for (RefreshOutcome outcome : outcomes.values()) {
      if (!outcome.succeeded()) {
        sourcesFailed++;
        continue;
      }
      sourcesRefreshed++;
      final SnapshotPair pair = outcome.pair();
      final List<TransitionEvent> events = detector.detect(pair.previous(), pair.current());
      transitions += events.size();
      recordTransitions(events);
      windows.addAll(consolidator.consolidate(events));
    }

    if (stopping.get()) {
      logger.info("engine cycle aborted before gate, engine is stopping windows={}", windows.size());
      return CycleReport.skipped(cycleId, startedAt);
    }

    final List<Subscription> subscriptions = subscriptionRepository.listActive();
    final List<SubscriptionMatch> matches = matcher.match(windows, subscriptions, today);
    final List<Digest> digests = gate.gate(matches);
    int digestsSent = 0;
    int digestsFailed = 0;
    for (Digest digest : digests) {
      // the record goes first; a failed send is not rolled back
      gate.record(digest);
      if (deliver(digest)) {
        digestsSent++;
      } else {
        digestsFailed++;
      }
    }
    notificationsSent.addAndGet(digestsSent);

    final Instant finishedAt = Instant.now(clock);
    final CycleReport report =
        new CycleReport(
            cycleId,
            startedAt,
            finishedAt,
            sourcesRefreshed,
            sourcesFailed,
            transitions,
            windows.size(),
            matches.size(),
            digestsSent,
            digestsFailed,
            false);
    totalCycles.incrementAndGet();
    if (report.succeeded()) {
      successfulCycles.incrementAndGet();
    } else {
      failedCycles.incrementAndGet();
    }
    metrics.recordCycle(report.succeeded() ? "success" : "failed", Duration.between(startedAt, finishedAt));
    logger.info(
        "engine cycle finished sourcesRefreshed={} sourcesFailed={} transitions={} windows={}"
            + " subscriptions={} matches={} digestsSent={} digestsFailed={}",
        sourcesRefreshed,
        sourcesFailed,
        transitions,
        windows.size(),
        subscriptions.size(),
        matches.size(),
        digestsSent,
        digestsFailed);
    return report;
  }

  private boolean deliver(Digest digest) {
    try {
      dispatcher.sendDigest(digest);
      metrics.recordDigest("sent");
      return true;
    } catch (DispatchException ex) {
      metrics.recordDigest("dispatch_failed");
      logger.warn(
          "digest dispatch failed, record kept digestId={} subscriptionId={}",
          digest.digestId(),
          digest.subscription().id(),
          ex);
      return false;
    } catch (RuntimeException ex) {
      metrics.recordDigest("dispatch_failed");
      logger.warn(
          "digest dispatch failed unexpectedly, record kept digestId={} subscriptionId={}",
          digest.digestId(),
          digest.subscription().id(),
          ex);
      return false;
    }
  }

  private void recordTransitions(List<TransitionEvent> events) {
    final long opened = events.stream().filter(TransitionEvent::isOpened).count();
    metrics.recordTransitions(TransitionKind.OPENED.name().toLowerCase(Locale.ROOT), (int) opened);
    metrics.recordTransitions(TransitionKind.CLOSED.name().toLowerCase(Locale.ROOT), events.size() - (int) opened);
  }

  @Override
  public void start() {
    final List<Subscription> active;
    try {
      active = subscriptionRepository.listActive();
    } catch (RuntimeException ex) {
      throw new EngineStartupException("active subscriptions could not be loaded", ex);
    }
    stopping.set(false);
    running.set(true);
    logger.info(
        "availability engine started sources={} activeSubscriptions={} pollInterval={} zone={}",
        sourceRegistry.sourceIds(),
        active.size(),
        engineProperties.pollInterval(),
        engineProperties.timeZone());
  }

  @Override
  public void stop() {
    stopping.set(true);
    running.set(false);
    snapshotFetchExecutor.shutdown();
    try {
      final long graceMillis = engineProperties.shutdownGrace().toMillis();
      if (!snapshotFetchExecutor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
        logger.warn("snapshot fetches still running after grace, cancelling grace={}", engineProperties.shutdownGrace());
        snapshotFetchExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      snapshotFetchExecutor.shutdownNow();
    }
    final String holder = holderId.get();
    if (holder != null) {
      cycleLease.release(holder);
    }
    logger.info("availability engine stopped");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  private String holderId() {
    final String existing = holderId.get();
    if (existing != null) {
      return existing;
    }
    final String resolved = resolveHolderId();
    holderId.compareAndSet(null, resolved);
    return holderId.get();
  }

  @VisibleForTesting
  String resolveHolderId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
