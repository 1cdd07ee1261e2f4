package com.example.courtalert.repository;

public class RepositoryJsonException extends RuntimeException {

  public RepositoryJsonException(String message, Throwable cause) {
    super(message, cause);
  }
}
