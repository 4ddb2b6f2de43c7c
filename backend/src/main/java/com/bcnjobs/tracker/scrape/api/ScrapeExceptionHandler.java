package com.bcnjobs.tracker.scrape.api;

import com.bcnjobs.tracker.scrape.service.ActiveScrapeRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
  }
}
