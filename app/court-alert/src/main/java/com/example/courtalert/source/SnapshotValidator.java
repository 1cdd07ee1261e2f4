/*
 * Where: Court alert source layer
 * What: Checks a fetched snapshot before it may replace the cached one
 */
package com.example.courtalert.source;

import com.example.courtalert.model.Slot;
import com.example.courtalert.model.Snapshot;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class SnapshotValidator {

  public void validate(String expectedSourceId, Snapshot snapshot) {
    if (snapshot == null) {
      throw new SnapshotInconsistencyException(expectedSourceId, "source returned no snapshot");
    }
    if (!expectedSourceId.equals(snapshot.sourceId())) {
      throw new SnapshotInconsistencyException(
          expectedSourceId,
          "snapshot belongs to another source expected=" + expectedSourceId + " actual=" + snapshot.sourceId());
    }
    for (Map.Entry<String, List<Slot>> entry : snapshot.slotsByCourt().entrySet()) {
      validateCourt(expectedSourceId, entry.getKey(), entry.getValue());
    }
  }

  private void validateCourt(String sourceId, String courtId, List<Slot> slots) {
    Slot previous = null;
    // slots are sorted by start inside Snapshot
    for (Slot slot : slots) {
      if (!courtId.equals(slot.courtId())) {
        throw new SnapshotInconsistencyException(
            sourceId, "slot filed under another court courtId=" + courtId + " slotCourtId=" + slot.courtId());
      }
      if (previous != null && slot.start().isBefore(previous.end())) {
        throw new SnapshotInconsistencyException(
            sourceId,
            "overlapping slots courtId=" + courtId + " first=" + previous.start() + ".." + previous.end()
                + " second=" + slot.start() + ".." + slot.end());
      }
      previous = slot;
    }
  }
}
