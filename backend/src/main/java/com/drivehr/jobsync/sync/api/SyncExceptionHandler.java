package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.sync.http.SyncTriggerException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(SyncTriggerException.class)
  public ResponseEntity<Map<String, Object>> handleTriggerFailure(SyncTriggerException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("message", ex.getMessage());
    return ResponseEntity.status(ex.getStatus()).body(body);
  }
}
