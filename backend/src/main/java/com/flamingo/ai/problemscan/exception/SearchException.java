package com.flamingo.ai.problemscan.exception;

/** Exception thrown when the problem repository search fails. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Problem search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
