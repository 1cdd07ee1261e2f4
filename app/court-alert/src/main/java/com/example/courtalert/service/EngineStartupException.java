package com.example.courtalert.service;

/** The engine could not load its working set at startup; the application must not come up. */
public class EngineStartupException extends RuntimeException {

  public EngineStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
