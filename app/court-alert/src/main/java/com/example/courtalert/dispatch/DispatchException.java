package com.example.courtalert.dispatch;

/** The transport could not deliver a digest; the notification record stays committed. */
public class DispatchException extends RuntimeException {

  private final String digestId;

  public DispatchException(String digestId, String message, Throwable cause) {
    super(message, cause);
    this.digestId = digestId;
  }

  public String digestId() {
    return digestId;
  }
}
