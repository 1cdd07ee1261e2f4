package com.example.courtalert.model;

import java.util.Set;

public record SourcePreference(String sourceId, Set<String> courtIds) {

  public SourcePreference {
    if (sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("sourceId is required");
    }
    courtIds = courtIds == null ? Set.of() : Set.copyOf(courtIds);
  }

  // empty courtIds means any court of the source
  public boolean matches(String candidateSourceId, String courtId) {
    return sourceId.equals(candidateSourceId) && (courtIds.isEmpty() || courtIds.contains(courtId));
  }
}
