package com.opsmonitor.monitoring.api;

import com.opsmonitor.monitoring.service.InvalidIntegrationRequestException;
import com.opsmonitor.monitoring.service.InvalidMonitoringJobException;
import com.opsmonitor.monitoring.service.JobRunInProgressException;
import com.opsmonitor.monitoring.service.MonitoringJobNotFoundException;
import com.opsmonitor.monitoring.service.RunCreationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitoringExceptionHandler {

  @ExceptionHandler(MonitoringJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(MonitoringJobNotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(InvalidMonitoringJobException.class)
  public ResponseEntity<Map<String, String>> handleInvalidJob(InvalidMonitoringJobException ex) {
    return body(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
  }

  @ExceptionHandler(InvalidIntegrationRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidIntegration(InvalidIntegrationRequestException ex) {
    return body(HttpStatus.BAD_REQUEST, "invalid_integration", ex.getMessage());
  }

  @ExceptionHandler(JobRunInProgressException.class)
  public ResponseEntity<Map<String, String>> handleRunInProgress(JobRunInProgressException ex) {
    return body(HttpStatus.CONFLICT, "run_in_progress", ex.getMessage());
  }

  @ExceptionHandler(RunCreationException.class)
  public ResponseEntity<Map<String, String>> handleRunCreation(RunCreationException ex) {
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "run_creation_failed", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", error, "message", message == null ? "" : message));
  }
}
