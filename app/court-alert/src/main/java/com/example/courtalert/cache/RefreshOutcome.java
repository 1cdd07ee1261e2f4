package com.example.courtalert.cache;

import com.example.courtalert.model.SnapshotPair;
import java.util.Optional;

public record RefreshOutcome(String sourceId, SnapshotPair pair, RuntimeException failure) {

  public static RefreshOutcome success(String sourceId, SnapshotPair pair) {
    return new RefreshOutcome(sourceId, pair, null);
  }

  public static RefreshOutcome failure(String sourceId, RuntimeException failure) {
    return new RefreshOutcome(sourceId, null, failure);
  }

  public boolean succeeded() {
    return failure == null;
  }

  public Optional<SnapshotPair> snapshots() {
    return Optional.ofNullable(pair);
  }
}
