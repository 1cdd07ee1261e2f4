package com.example.courtalert.model;

import java.util.Objects;
import java.util.Optional;

public record SnapshotPair(Snapshot previous, Snapshot current) {

  public SnapshotPair {
    Objects.requireNonNull(current, "current");
  }

  public Optional<Snapshot> previousSnapshot() {
    return Optional.ofNullable(previous);
  }

  public SnapshotPair promote(Snapshot next) {
    return new SnapshotPair(current, next);
  }
}
