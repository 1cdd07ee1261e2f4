/*
 * Where: Shared utilities
 * What: Generates identifiers for engine cycles and outbound digests
 * Why: Log lines and stored records of one cycle share a correlatable id
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final int SHORT_ID_LENGTH = 8;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String shortId(String traceId) {
    if (traceId == null || traceId.length() <= SHORT_ID_LENGTH) {
      return traceId;
    }
    return traceId.substring(0, SHORT_ID_LENGTH);
  }
}
