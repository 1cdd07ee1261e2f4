/*
 * Where: Court alert source layer
 * What: Availability source reading a JSON availability grid over HTTP
 * Why: Platforms exposing the common JSON shape are configured without writing code
 */
package com.example.courtalert.source;

import com.example.courtalert.config.SourceProperties;
import com.example.courtalert.model.DateRange;
import com.example.courtalert.model.Slot;
import com.example.courtalert.model.SlotStatus;
import com.example.courtalert.model.Snapshot;
import com.example.courtalert.source.dto.SourceSnapshotResponse;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class HttpAvailabilitySource implements AvailabilitySource {

  private static final Logger logger = LoggerFactory.getLogger(HttpAvailabilitySource.class);

  private final SourceProperties.Source properties;
  private final RestClient restClient;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and Clock are shared immutable components")
  public HttpAvailabilitySource(SourceProperties.Source properties, RestClient restClient, Clock clock) {
    this.properties = properties;
    this.restClient = restClient;
    this.clock = clock;
  }

  @Override
  public String sourceId() {
    return properties.id();
  }

  @Override
  public String displayName() {
    return properties.displayName();
  }

  @Override
  public Snapshot fetchSnapshot(DateRange dateRange) {
    final SourceSnapshotResponse response;
    try {
      response =
          restClient
              .get()
              .uri(properties.snapshotPath(), dateRange.from(), dateRange.to())
              .retrieve()
              .body(SourceSnapshotResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RuntimeException ex) {
      logger.warn("availability response parse failed sourceId={}", sourceId(), ex);
      throw new SourceException(
          sourceId(), SourceException.Reason.DATA_INVALID, "availability response parse failed", ex);
    }
    return toSnapshot(response, dateRange);
  }

  @VisibleForTesting
  Snapshot toSnapshot(SourceSnapshotResponse response, DateRange requested) {
    if (response == null || response.courts() == null) {
      throw new SourceException(
          sourceId(), SourceException.Reason.DATA_INVALID, "availability response is empty");
    }
    final Map<String, List<Slot>> slotsByCourt = new LinkedHashMap<>();
    try {
      for (SourceSnapshotResponse.CourtPayload court : response.courts()) {
        final List<Slot> slots = new ArrayList<>();
        if (court.slots() != null) {
          for (SourceSnapshotResponse.SlotPayload slot : court.slots()) {
            slots.add(
                new Slot(court.courtId(), slot.start(), slot.end(), SlotStatus.fromExternal(slot.status())));
          }
        }
        if (slotsByCourt.putIfAbsent(court.courtId(), slots) != null) {
          throw new IllegalArgumentException("duplicate court in response courtId=" + court.courtId());
        }
      }
      final DateRange covered =
          response.dateFrom() != null && response.dateTo() != null
              ? new DateRange(response.dateFrom(), response.dateTo())
              : requested;
      final Instant capturedAt = response.capturedAt() != null ? response.capturedAt() : Instant.now(clock);
      return new Snapshot(sourceId(), capturedAt, covered, slotsByCourt);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new SourceException(
          sourceId(), SourceException.Reason.DATA_INVALID, "availability response is malformed: " + ex.getMessage(), ex);
    }
  }

  private SourceException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "availability fetch failed with http status={} statusText={} sourceId={}",
        ex.getStatusCode().value(),
        ex.getStatusText(),
        sourceId());
    if (ex.getStatusCode().is5xxServerError()) {
      return new SourceException(
          sourceId(), SourceException.Reason.UNAVAILABLE, "availability server error", ex);
    }
    return new SourceException(
        sourceId(), SourceException.Reason.UNAVAILABLE, "availability request failed", ex);
  }

  private SourceException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("availability fetch timed out sourceId={}", sourceId());
      return new SourceException(
          sourceId(), SourceException.Reason.TIMEOUT, "availability request timeout", ex);
    }
    logger.warn("availability fetch connection failed sourceId={}", sourceId(), ex);
    return new SourceException(
        sourceId(), SourceException.Reason.UNAVAILABLE, "availability connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
