/*
 * Where: Court alert engine worker
 * What: Starts an engine cycle on a fixed delay
 * Why: A failed cycle is logged and the next one still runs on schedule
 */
package com.example.courtalert.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "court-alert.engine.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EngineWorker {

  private static final Logger logger = LoggerFactory.getLogger(EngineWorker.class);

  private final AvailabilityEngine engine;

  @Scheduled(fixedDelayString = "${court-alert.engine.poll-interval:PT60S}")
  public void run() {
    try {
      engine.runCycle();
    } catch (RuntimeException ex) {
      logger.error("engine cycle failed", ex);
    }
  }
}
