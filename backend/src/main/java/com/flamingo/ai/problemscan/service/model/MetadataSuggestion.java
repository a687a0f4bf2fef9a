package com.flamingo.ai.problemscan.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Guessed exam type, subject and category used to pre-fill manual entry. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetadataSuggestion(String examType, String subject, String category) {

  public static MetadataSuggestion empty() {
    return new MetadataSuggestion(null, null, null);
  }
}
