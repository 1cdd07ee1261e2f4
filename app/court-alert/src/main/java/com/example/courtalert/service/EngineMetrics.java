/*
 * Where: Court alert service layer
 * What: Records cycle, source refresh, transition and digest metrics
 * Why: Per-source failures and suppressed alerts are observed without reading logs
 */
package com.example.courtalert.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring managed component")
public class EngineMetrics {

  private static final String METRIC_CYCLE_TOTAL = "court_alert.cycle.total";
  private static final String METRIC_CYCLE_DURATION = "court_alert.cycle.duration";
  private static final String METRIC_SOURCE_REFRESH_TOTAL = "court_alert.source.refresh.total";
  private static final String METRIC_TRANSITION_TOTAL = "court_alert.transition.total";
  private static final String METRIC_MATCH_SUPPRESSED_TOTAL = "court_alert.match.suppressed.total";
  private static final String METRIC_DIGEST_TOTAL = "court_alert.digest.total";
  private static final String METRIC_SOURCES_TRACKED = "court_alert.sources.tracked";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger sourcesTracked = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer cycleDurationTimer;

  public EngineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SOURCES_TRACKED, sourcesTracked, AtomicInteger::get)
        .description("Number of sources holding a cached snapshot")
        .register(meterRegistry);
    this.cycleDurationTimer =
        Timer.builder(METRIC_CYCLE_DURATION)
            .description("Wall time of one engine cycle")
            .register(meterRegistry);
  }

  public void recordCycle(String result, Duration duration) {
    counter(METRIC_CYCLE_TOTAL, "Engine cycle outcomes", Tags.of("result", result)).increment();
    if (duration != null && !duration.isNegative()) {
      cycleDurationTimer.record(duration);
    }
  }

  public void recordSourceRefresh(String sourceId, String result) {
    counter(
            METRIC_SOURCE_REFRESH_TOTAL,
            "Source refresh outcomes",
            Tags.of("source", sourceId, "result", result))
        .increment();
  }

  public void recordTransitions(String kind, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_TRANSITION_TOTAL, "Detected availability transitions", Tags.of("kind", kind))
        .increment(count);
  }

  public void recordSuppressed(String reason) {
    counter(METRIC_MATCH_SUPPRESSED_TOTAL, "Matches suppressed by the gate", Tags.of("reason", reason))
        .increment();
  }

  public void recordDigest(String result) {
    counter(METRIC_DIGEST_TOTAL, "Digest dispatch outcomes", Tags.of("result", result)).increment();
  }

  public void updateSourcesTracked(int count) {
    sourcesTracked.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
