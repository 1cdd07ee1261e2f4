package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsAUuid() {
    final String traceId = TraceIds.newTraceId();

    assertThat(UUID.fromString(traceId).toString()).isEqualTo(traceId);
    assertThat(TraceIds.newTraceId()).isNotEqualTo(traceId);
  }

  @Test
  void shortIdKeepsTheFirstEightCharacters() {
    assertThat(TraceIds.shortId("0123456789abcdef")).isEqualTo("01234567");
    assertThat(TraceIds.shortId("abc")).isEqualTo("abc");
    assertThat(TraceIds.shortId(null)).isNull();
  }
}
