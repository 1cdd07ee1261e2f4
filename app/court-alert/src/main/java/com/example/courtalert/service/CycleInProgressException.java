package com.example.courtalert.service;

public class CycleInProgressException extends RuntimeException {

  public CycleInProgressException() {
    super("an engine cycle is already running");
  }
}
