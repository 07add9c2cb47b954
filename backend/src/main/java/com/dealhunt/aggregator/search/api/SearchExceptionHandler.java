package com.dealhunt.aggregator.search.api;

import com.dealhunt.aggregator.search.provider.ProductNotFoundException;
import com.dealhunt.aggregator.search.provider.UpstreamProviderException;
import com.dealhunt.aggregator.search.service.SearchValidationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SearchExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(SearchExceptionHandler.class);

  @ExceptionHandler(SearchValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(SearchValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
  }

  @ExceptionHandler(ProductNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ProductNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "product_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(UpstreamProviderException.class)
  public ResponseEntity<Map<String, String>> handleUpstream(UpstreamProviderException ex) {
    log.warn("Marketplace {} unavailable: {}", ex.getProviderId(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of(
            "error", "marketplace_unavailable",
            "message", ex.getProviderId() + " service error: " + ex.getMessage()));
  }
}
