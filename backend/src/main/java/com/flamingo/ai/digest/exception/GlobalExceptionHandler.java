package com.flamingo.ai.digest.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ItemNotFoundException.class)
  public ResponseEntity<ApiError> handleItemNotFound(
      ItemNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("item_not_found");
    String errorId = generateErrorId();
    log.warn("Item not found [{}]: {}", errorId, ex.getItemId());

    return respond(
        HttpStatus.NOT_FOUND, ApiError.ITEM_NOT_FOUND, "Item not found", errorId, request);
  }

  @ExceptionHandler(ItemNotRetryableException.class)
  public ResponseEntity<ApiError> handleNotRetryable(
      ItemNotRetryableException ex, HttpServletRequest request) {

    incrementErrorCounter("item_not_retryable");
    String errorId = generateErrorId();
    log.warn("Item not retryable [{}]: {} is {}", errorId, ex.getItemId(), ex.getStatus());

    return respond(
        HttpStatus.CONFLICT, ApiError.ITEM_NOT_RETRYABLE, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(ChannelNotFoundException.class)
  public ResponseEntity<ApiError> handleChannelNotFound(
      ChannelNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("channel_not_found");
    String errorId = generateErrorId();
    log.warn("Channel not found [{}]: {}", errorId, ex.getUsername());

    return respond(
        HttpStatus.NOT_FOUND, ApiError.CHANNEL_NOT_FOUND, "Channel not found", errorId, request);
  }

  @ExceptionHandler(InvalidWindowException.class)
  public ResponseEntity<ApiError> handleInvalidWindow(
      InvalidWindowException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_window");
    String errorId = generateErrorId();
    log.warn("Invalid window [{}]: {} / {}", errorId, ex.getStart(), ex.getEnd());

    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.INVALID_WINDOW,
        "Window start must be before window end",
        errorId,
        request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {

    String errorType = ex.isTransient() ? "storage_unavailable" : "storage_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);

    if (ex.isTransient()) {
      return respond(
          HttpStatus.SERVICE_UNAVAILABLE,
          ApiError.STORAGE_UNAVAILABLE,
          "The database is busy. Please try again later.",
          errorId,
          request);
    }
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.STORAGE_ERROR,
        "A storage error occurred.",
        errorId,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        errorId,
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String code, String message, String errorId, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api.errors", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
