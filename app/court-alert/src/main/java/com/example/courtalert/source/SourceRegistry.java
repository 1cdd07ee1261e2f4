/*
 * Where: Court alert source layer
 * What: Explicit registry of availability sources built once at startup
 * Why: The engine and readers look sources up without a process-wide singleton
 */
package com.example.courtalert.source;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

public class SourceRegistry {

  private final Map<String, AvailabilitySource> sources;

  public SourceRegistry(Collection<? extends AvailabilitySource> sources) {
    final TreeMap<String, AvailabilitySource> byId = new TreeMap<>();
    for (AvailabilitySource source : sources) {
      final AvailabilitySource existing = byId.putIfAbsent(source.sourceId(), source);
      if (existing != null) {
        throw new IllegalStateException("duplicate availability source id=" + source.sourceId());
      }
    }
    this.sources = Collections.unmodifiableMap(byId);
  }

  public Optional<AvailabilitySource> find(String sourceId) {
    return Optional.ofNullable(sources.get(sourceId));
  }

  public AvailabilitySource require(String sourceId) {
    return find(sourceId)
        .orElseThrow(() -> new UnknownSourceException(sourceId));
  }

  /** Source ids in ascending order, the order cycles process them in. */
  public Set<String> sourceIds() {
    return sources.keySet();
  }

  public List<AvailabilitySource> all() {
    return List.copyOf(sources.values());
  }

  public String displayName(String sourceId) {
    return find(sourceId).map(AvailabilitySource::displayName).orElse(sourceId);
  }

  public int size() {
    return sources.size();
  }
}
