package com.flamingo.ai.problemscan.exception;

/** Exception thrown when no text could be extracted from an uploaded image. */
public class OcrProcessingException extends RuntimeException {

  private final String userMessage;

  public OcrProcessingException(String message) {
    super(message);
    this.userMessage = "Could not extract text from the image";
  }

  public OcrProcessingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Could not extract text from the image";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
