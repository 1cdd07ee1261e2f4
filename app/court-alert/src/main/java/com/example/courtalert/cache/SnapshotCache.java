/*
 * Where: Court alert cache layer
 * What: Holds the current and previous snapshot of every source plus its refresh health
 * Why: User-facing reads are served from memory, never from the booking platform
 */
package com.example.courtalert.cache;

import com.example.courtalert.model.Snapshot;
import com.example.courtalert.model.SnapshotPair;
import com.example.courtalert.model.SourceHealth;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class SnapshotCache {

  // each value is replaced as a whole, never mutated in place
  private final ConcurrentMap<String, SnapshotPair> pairs = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, SourceHealth> health = new ConcurrentHashMap<>();

  /** Promotes current to previous and installs the new snapshot as current in one swap. */
  public SnapshotPair install(Snapshot snapshot) {
    return pairs.compute(
        snapshot.sourceId(),
        (sourceId, existing) ->
            existing == null ? new SnapshotPair(null, snapshot) : existing.promote(snapshot));
  }

  public Optional<SnapshotPair> pair(String sourceId) {
    return Optional.ofNullable(pairs.get(sourceId));
  }

  public Optional<Snapshot> currentSnapshot(String sourceId) {
    return pair(sourceId).map(SnapshotPair::current);
  }

  public Optional<Snapshot> previousSnapshot(String sourceId) {
    return pair(sourceId).flatMap(SnapshotPair::previousSnapshot);
  }

  public int sourcesCached() {
    return pairs.size();
  }

  public void recordSuccess(String sourceId, Instant at) {
    health.compute(
        sourceId,
        (id, existing) -> (existing == null ? SourceHealth.initial(id) : existing).succeeded(at));
  }

  public void recordFailure(String sourceId, Instant at, String error, boolean inconsistent) {
    health.compute(
        sourceId,
        (id, existing) ->
            (existing == null ? SourceHealth.initial(id) : existing).failed(at, error, inconsistent));
  }

  public Optional<SourceHealth> health(String sourceId) {
    return Optional.ofNullable(health.get(sourceId));
  }

  public List<SourceHealth> allHealth() {
    return health.values().stream().sorted(Comparator.comparing(SourceHealth::sourceId)).toList();
  }
}
