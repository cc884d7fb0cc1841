package com.catalogharvester.crawl.api;

import com.catalogharvester.crawl.listing.ListingWalkException;
import com.catalogharvester.crawl.service.ActiveCrawlRunException;
import com.catalogharvester.crawl.service.InvalidRunConfigurationException;
import com.catalogharvester.crawl.state.CheckpointException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidRunConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfiguration(InvalidRunConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_run_configuration", "message", ex.getMessage()));
  }

  @ExceptionHandler(CheckpointException.class)
  public ResponseEntity<Map<String, String>> handleCheckpoint(CheckpointException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "checkpoint_failed", "message", ex.getMessage()));
  }

  @ExceptionHandler(ListingWalkException.class)
  public ResponseEntity<Map<String, String>> handleListingWalk(ListingWalkException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "listing_walk_failed", "message", ex.getMessage()));
  }
}
