/*
 * Where: Court alert operator API
 * What: Engine statistics and manual cycle trigger
 */
package com.example.courtalert.api;

import com.example.courtalert.model.CycleReport;
import com.example.courtalert.model.EngineStats;
import com.example.courtalert.service.AvailabilityEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/engine")
@RequiredArgsConstructor
public class EngineAdminController {

  private final AvailabilityEngine engine;

  @GetMapping("/stats")
  public EngineStats stats() {
    return engine.getEngineStats();
  }

  // runs on the request thread; 409 while another cycle holds the engine
  @PostMapping("/cycles")
  public CycleReport triggerCycle() {
    return engine.triggerManualCycle();
  }
}
