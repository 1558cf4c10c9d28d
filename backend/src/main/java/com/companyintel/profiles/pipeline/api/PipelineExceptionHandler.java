package com.companyintel.profiles.pipeline.api;

import com.companyintel.profiles.pipeline.service.ActivePipelineRunException;
import com.companyintel.profiles.pipeline.service.InputDirectoryMissingException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
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

  @ExceptionHandler(InputDirectoryMissingException.class)
  public ResponseEntity<Map<String, String>> handleMissingInput(InputDirectoryMissingException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "input_directory_missing", "message", ex.getMessage()));
  }

  @ExceptionHandler(NoSuchFileException.class)
  public ResponseEntity<Map<String, String>> handleMissingFile(NoSuchFileException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "file_not_found", "message", String.valueOf(ex.getFile())));
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<Map<String, String>> handleIo(IOException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "io_error", "message", String.valueOf(ex.getMessage())));
  }
}
