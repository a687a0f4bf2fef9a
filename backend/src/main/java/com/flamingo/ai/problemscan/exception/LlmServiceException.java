package com.flamingo.ai.problemscan.exception;

/**
 * Exception raised when an LLM call fails or returns content that does not match the expected
 * schema. Contained inside the AI segmentation and ranking paths, which fall back instead of
 * propagating it.
 */
public class LlmServiceException extends RuntimeException {

  private final boolean malformedResponse;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.malformedResponse = false;
  }

  public LlmServiceException(String message, boolean malformedResponse) {
    super(message);
    this.malformedResponse = malformedResponse;
  }

  public static LlmServiceException malformed(String message) {
    return new LlmServiceException(message, true);
  }

  public boolean isMalformedResponse() {
    return malformedResponse;
  }
}
