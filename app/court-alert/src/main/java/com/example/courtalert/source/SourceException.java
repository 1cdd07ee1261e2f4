/*
 * Where: Court alert source layer
 * What: Failure of one availability source during a refresh
 * Why: The refresher isolates it per source and reports the reason through engine stats
 */
package com.example.courtalert.source;

public class SourceException extends RuntimeException {

  public enum Reason {
    UNAVAILABLE,
    TIMEOUT,
    DATA_INVALID
  }

  private final String sourceId;
  private final Reason reason;

  public SourceException(String sourceId, Reason reason, String message) {
    super(message);
    this.sourceId = sourceId;
    this.reason = reason;
  }

  public SourceException(String sourceId, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.sourceId = sourceId;
    this.reason = reason;
  }

  public String sourceId() {
    return sourceId;
  }

  public Reason reason() {
    return reason;
  }
}
