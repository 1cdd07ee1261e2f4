package com.example.courtalert.cache;

import static com.example.courtalert.support.Fixtures.open;
import static com.example.courtalert.support.Fixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.courtalert.config.CacheProperties;
import com.example.courtalert.model.CachedSnapshot;
import com.example.courtalert.source.SourceRegistry;
import com.example.courtalert.source.UnknownSourceException;
import com.example.courtalert.support.Fixtures;
import com.example.courtalert.support.MutableClock;
import com.example.courtalert.support.ScriptedAvailabilitySource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotQueryServiceTest {

  private static final Instant REFRESHED_AT = Instant.parse("2026-10-18T08:00:00Z");

  private SnapshotCache cache;
  private MutableClock clock;
  private SnapshotQueryService service;

  @BeforeEach
  void setUp() {
    cache = new SnapshotCache();
    clock = new MutableClock(REFRESHED_AT.plusSeconds(30));
    service =
        new SnapshotQueryService(
            cache,
            new SourceRegistry(List.of(new ScriptedAvailabilitySource(Fixtures.SOURCE_ID))),
            new CacheProperties(8, 4, Duration.ofSeconds(20), Duration.ofMinutes(5)),
            clock);
  }

  @Test
  void unknownSourceIsRejected() {
    assertThatThrownBy(() -> service.getCachedSnapshot("nope"))
        .isInstanceOf(UnknownSourceException.class);
  }

  @Test
  void registeredSourceWithoutSnapshotIsEmpty() {
    assertThat(service.getCachedSnapshot(Fixtures.SOURCE_ID)).isEmpty();
  }

  @Test
  void freshSnapshotIsNotStale() {
    cacheSnapshot();

    final CachedSnapshot cached = service.getCachedSnapshot(Fixtures.SOURCE_ID).orElseThrow();

    assertThat(cached.stale()).isFalse();
    assertThat(cached.lastRefreshedAt()).isEqualTo(REFRESHED_AT);
  }

  @Test
  void snapshotIsStaleAfterAFailedRefresh() {
    cacheSnapshot();
    cache.recordFailure(Fixtures.SOURCE_ID, REFRESHED_AT.plusSeconds(60), "503", false);

    final CachedSnapshot cached = service.getCachedSnapshot(Fixtures.SOURCE_ID).orElseThrow();

    assertThat(cached.stale()).isTrue();
    assertThat(cached.lastRefreshedAt()).isEqualTo(REFRESHED_AT);
  }

  @Test
  void snapshotIsStaleOnceOlderThanTheLimit() {
    cacheSnapshot();
    clock.set(REFRESHED_AT.plus(Duration.ofMinutes(6)));

    assertThat(service.getCachedSnapshot(Fixtures.SOURCE_ID).orElseThrow().stale()).isTrue();
  }

  private void cacheSnapshot() {
    cache.install(snapshot(REFRESHED_AT, open("A1", "10:00", "11:00")));
    cache.recordSuccess(Fixtures.SOURCE_ID, REFRESHED_AT);
  }
}
