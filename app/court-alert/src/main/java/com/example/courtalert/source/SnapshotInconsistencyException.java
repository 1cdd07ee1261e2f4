package com.example.courtalert.source;

public class SnapshotInconsistencyException extends RuntimeException {

  private final String sourceId;

  public SnapshotInconsistencyException(String sourceId, String message) {
    super(message);
    this.sourceId = sourceId;
  }

  public String sourceId() {
    return sourceId;
  }
}
