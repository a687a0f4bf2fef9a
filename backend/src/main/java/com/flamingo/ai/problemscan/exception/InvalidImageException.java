package com.flamingo.ai.problemscan.exception;

/** Exception thrown when an upload is missing or is not an accepted image type. */
public class InvalidImageException extends RuntimeException {

  public InvalidImageException(String message) {
    super(message);
  }
}
