/*
 * Where: Court alert debug API
 * What: Serves the cached snapshot of a source
 * Why: Operators inspect what the engine diffed without calling the booking platform
 */
package com.example.courtalert.api;

import com.example.courtalert.cache.SnapshotQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/sources")
@RequiredArgsConstructor
public class SnapshotDebugController {

  private final SnapshotQueryService queryService;

  @GetMapping("/{sourceId}/snapshot")
  public SnapshotResponse snapshot(@PathVariable("sourceId") String sourceId) {
    return queryService
        .getCachedSnapshot(sourceId)
        .map(SnapshotResponse::from)
        .orElseThrow(() -> new SnapshotNotCachedException(sourceId));
  }
}
