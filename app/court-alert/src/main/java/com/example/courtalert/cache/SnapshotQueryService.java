/*
 * Where: Court alert cache layer
 * What: Read path for user-facing callers
 * Why: Answers from memory only; an unreachable source shows up as a stale flag, not an error
 */
package com.example.courtalert.cache;

import com.example.courtalert.config.CacheProperties;
import com.example.courtalert.model.CachedSnapshot;
import com.example.courtalert.model.Snapshot;
import com.example.courtalert.model.SourceHealth;
import com.example.courtalert.source.SourceRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SnapshotQueryService {

  private final SnapshotCache cache;
  private final SourceRegistry sourceRegistry;
  private final CacheProperties cacheProperties;
  private final Clock clock;

  /**
   * Returns the cached snapshot of a registered source.
   *
   * @throws com.example.courtalert.source.UnknownSourceException when no source has this id
   */
  public Optional<CachedSnapshot> getCachedSnapshot(String sourceId) {
    sourceRegistry.require(sourceId);
    final Optional<Snapshot> current = cache.currentSnapshot(sourceId);
    if (current.isEmpty()) {
      return Optional.empty();
    }
    final Optional<SourceHealth> health = cache.health(sourceId);
    final Instant lastRefreshedAt =
        health.map(SourceHealth::lastSuccessAt).orElse(current.get().capturedAt());
    return Optional.of(new CachedSnapshot(current.get(), isStale(health, lastRefreshedAt), lastRefreshedAt));
  }

  private boolean isStale(Optional<SourceHealth> health, Instant lastRefreshedAt) {
    if (health.map(SourceHealth::lastAttemptFailed).orElse(false)) {
      return true;
    }
    final Duration age = Duration.between(lastRefreshedAt, Instant.now(clock));
    return age.compareTo(cacheProperties.staleAfter()) > 0;
  }
}
