package com.openlead.intel.pipeline.api;

import com.openlead.intel.pipeline.service.ActivePipelineRunException;
import com.openlead.intel.pipeline.service.PipelineConfigurationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(ActivePipelineRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActivePipelineRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_pipeline_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(PipelineConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(PipelineConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_pipeline_config", "message", ex.getMessage()));
  }
}
