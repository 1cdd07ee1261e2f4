package com.example.courtalert.api;

import com.example.courtalert.service.CycleInProgressException;
import com.example.courtalert.source.UnknownSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UnknownSourceException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownSource(UnknownSourceException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("COURT_ALERT_SOURCE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(SnapshotNotCachedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotCached(SnapshotNotCachedException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("COURT_ALERT_SNAPSHOT_NOT_CACHED", ex.getMessage()));
  }

  @ExceptionHandler(CycleInProgressException.class)
  public ResponseEntity<ApiErrorResponse> handleCycleInProgress(CycleInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("COURT_ALERT_CYCLE_IN_PROGRESS", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("operator request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("COURT_ALERT_INTERNAL_ERROR", ex.getMessage()));
  }
}
