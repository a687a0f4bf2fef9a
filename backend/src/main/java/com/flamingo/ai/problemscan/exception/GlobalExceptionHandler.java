package com.flamingo.ai.problemscan.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidImageException.class)
  public ResponseEntity<ApiError> handleInvalidImage(
      InvalidImageException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_image");
    String errorId = generateErrorId();
    log.warn("Invalid image [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_IMAGE, ex.getMessage(), request);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiError> handleMissingPart(
      MissingServletRequestPartException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_image");
    String errorId = generateErrorId();
    log.warn("Missing request part [{}]: {}", errorId, ex.getRequestPartName());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_IMAGE, "No image file provided", request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_TOO_LARGE,
        "Image exceeds the maximum upload size",
        request);
  }

  @ExceptionHandler(OcrProcessingException.class)
  public ResponseEntity<ApiError> handleOcrProcessing(
      OcrProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("ocr_failed");
    String errorId = generateErrorId();
    log.warn("OCR processing failed [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.OCR_FAILED,
        "OCR processing failed: " + ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("search_circuit_open");
    String errorId = generateErrorId();
    log.warn("Circuit open [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_UNAVAILABLE,
        "Problem search is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    MissingRequestHeaderException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex instanceof MethodArgumentNotValidException invalid
            ? invalid.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed")
            : ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "Internal server error",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
