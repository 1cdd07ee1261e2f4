/*
 * Where: Court alert cache layer
 * What: Pulls fresh snapshots from sources on a bounded pool and installs them in the cache
 * Why: A slow or broken source must neither block other sources nor evict its last good snapshot
 */
package com.example.courtalert.cache;

import com.example.courtalert.config.CacheProperties;
import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.model.DateRange;
import com.example.courtalert.model.Snapshot;
import com.example.courtalert.model.SnapshotPair;
import com.example.courtalert.service.EngineMetrics;
import com.example.courtalert.source.AvailabilitySource;
import com.example.courtalert.source.SnapshotInconsistencyException;
import com.example.courtalert.source.SnapshotValidator;
import com.example.courtalert.source.SourceException;
import com.example.courtalert.source.SourceRegistry;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SnapshotRefresher {

  private static final Logger logger = LoggerFactory.getLogger(SnapshotRefresher.class);

  private final SourceRegistry sourceRegistry;
  private final SnapshotCache cache;
  private final SnapshotValidator validator;
  private final CacheProperties cacheProperties;
  private final EngineProperties engineProperties;
  private final ExecutorService snapshotFetchExecutor;
  private final EngineMetrics metrics;
  private final Clock clock;

  /**
   * Refreshes one source. On success the returned pair holds the new snapshot and the one it
   * displaced; on failure the cached snapshot stays untouched.
   */
  public SnapshotPair refresh(String sourceId) {
    final DateRange dateRange = currentDateRange();
    final Future<Snapshot> future = submit(sourceId, dateRange);
    return complete(sourceId, future, deadlineAfter(1));
  }

  /** Refreshes sources concurrently; one failing source never prevents the others. */
  public Map<String, RefreshOutcome> refreshAll(Collection<String> sourceIds) {
    final DateRange dateRange = currentDateRange();
    final Map<String, Future<Snapshot>> inFlight = new LinkedHashMap<>();
    final Map<String, RefreshOutcome> outcomes = new LinkedHashMap<>();
    for (String sourceId : sourceIds) {
      try {
        inFlight.put(sourceId, submit(sourceId, dateRange));
      } catch (RuntimeException ex) {
        outcomes.put(sourceId, RefreshOutcome.failure(sourceId, ex));
      }
    }
    // one deadline for the whole batch, sized by how many rounds the bounded pool needs
    final int rounds =
        Math.max(1, (inFlight.size() + cacheProperties.maxConcurrentFetches() - 1)
            / cacheProperties.maxConcurrentFetches());
    final long deadline = deadlineAfter(rounds);
    for (Map.Entry<String, Future<Snapshot>> entry : inFlight.entrySet()) {
      final String sourceId = entry.getKey();
      try {
        outcomes.put(
            sourceId, RefreshOutcome.success(sourceId, complete(sourceId, entry.getValue(), deadline)));
      } catch (SourceException | SnapshotInconsistencyException ex) {
        outcomes.put(sourceId, RefreshOutcome.failure(sourceId, ex));
      }
    }
    final Map<String, RefreshOutcome> ordered = new LinkedHashMap<>();
    for (String sourceId : sourceIds) {
      ordered.put(sourceId, outcomes.get(sourceId));
    }
    return ordered;
  }

  @VisibleForTesting
  DateRange currentDateRange() {
    final LocalDate today = LocalDate.now(clock.withZone(engineProperties.timeZone()));
    return DateRange.startingAt(today, cacheProperties.fetchDays());
  }

  private Future<Snapshot> submit(String sourceId, DateRange dateRange) {
    final AvailabilitySource source = sourceRegistry.require(sourceId);
    try {
      return snapshotFetchExecutor.submit(() -> source.fetchSnapshot(dateRange));
    } catch (RejectedExecutionException ex) {
      final SourceException failure =
          new SourceException(sourceId, SourceException.Reason.UNAVAILABLE, "fetch pool rejected the refresh", ex);
      recordFailure(sourceId, failure, false);
      throw failure;
    }
  }

  private long deadlineAfter(int rounds) {
    return System.nanoTime() + cacheProperties.fetchTimeout().toNanos() * rounds;
  }

  private SnapshotPair complete(String sourceId, Future<Snapshot> future, long deadline) {
    final Snapshot snapshot;
    try {
      snapshot = await(sourceId, future, deadline);
      validator.validate(sourceId, snapshot);
    } catch (SourceException ex) {
      recordFailure(sourceId, ex, false);
      throw ex;
    } catch (SnapshotInconsistencyException ex) {
      logger.error("snapshot discarded, flagged for review sourceId={} reason={}", sourceId, ex.getMessage());
      recordFailure(sourceId, ex, true);
      throw ex;
    }
    final SnapshotPair pair = cache.install(snapshot);
    cache.recordSuccess(sourceId, Instant.now(clock));
    metrics.recordSourceRefresh(sourceId, "success");
    metrics.updateSourcesTracked(cache.sourcesCached());
    logger.info(
        "snapshot cached sourceId={} courts={} slots={} open={} coldStart={}",
        sourceId,
        snapshot.courtIds().size(),
        snapshot.slotCount(),
        snapshot.openSlotCount(),
        pair.previous() == null);
    return pair;
  }

  private Snapshot await(String sourceId, Future<Snapshot> future, long deadline) {
    try {
      return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new SourceException(
          sourceId,
          SourceException.Reason.TIMEOUT,
          "snapshot fetch missed the refresh deadline, fetch timeout " + cacheProperties.fetchTimeout(),
          ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new SourceException(
          sourceId, SourceException.Reason.UNAVAILABLE, "snapshot fetch interrupted", ex);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof SourceException sourceException) {
        throw sourceException;
      }
      throw new SourceException(
          sourceId,
          SourceException.Reason.UNAVAILABLE,
          "snapshot fetch failed: " + (cause == null ? ex.getMessage() : cause.getMessage()),
          cause == null ? ex : cause);
    }
  }

  private void recordFailure(String sourceId, RuntimeException failure, boolean inconsistent) {
    cache.recordFailure(sourceId, Instant.now(clock), failure.getMessage(), inconsistent);
    metrics.recordSourceRefresh(sourceId, resultTag(failure));
    if (!inconsistent) {
      logger.warn(
          "snapshot refresh failed, keeping cached snapshot sourceId={} reason={} message={}",
          sourceId,
          failure instanceof SourceException sourceException ? sourceException.reason() : "UNKNOWN",
          failure.getMessage());
    }
  }

  private String resultTag(RuntimeException failure) {
    if (failure instanceof SourceException sourceException) {
      return sourceException.reason().name().toLowerCase(Locale.ROOT);
    }
    return "inconsistent";
  }
}
