package com.flamingo.ai.problemscan.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_IMAGE = "IMAGE_001";
  public static final String OCR_FAILED = "OCR_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String SEARCH_UNAVAILABLE = "SEARCH_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String UPLOAD_TOO_LARGE = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
