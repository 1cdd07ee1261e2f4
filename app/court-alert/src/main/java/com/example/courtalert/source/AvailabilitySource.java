/*
 * Where: Court alert source layer
 * What: Contract every booking platform integration implements
 * Why: The engine polls platforms polymorphically instead of branching on a platform tag
 */
package com.example.courtalert.source;

import com.example.courtalert.model.DateRange;
import com.example.courtalert.model.Snapshot;

public interface AvailabilitySource {

  String sourceId();

  String displayName();

  /**
   * Fetches the availability grid for the given local date range.
   *
   * @throws SourceException with reason UNAVAILABLE, TIMEOUT or DATA_INVALID
   */
  Snapshot fetchSnapshot(DateRange dateRange);
}
