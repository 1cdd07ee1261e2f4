package com.example.courtalert.source;

public class UnknownSourceException extends RuntimeException {

  private final String sourceId;

  public UnknownSourceException(String sourceId) {
    super("availability source not registered sourceId=" + sourceId);
    this.sourceId = sourceId;
  }

  public String sourceId() {
    return sourceId;
  }
}
