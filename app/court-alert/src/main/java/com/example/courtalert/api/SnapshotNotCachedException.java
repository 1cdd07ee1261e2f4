package com.example.courtalert.api;

public class SnapshotNotCachedException extends RuntimeException {

  public SnapshotNotCachedException(String sourceId) {
    super("no snapshot cached yet for source id=" + sourceId);
  }
}
