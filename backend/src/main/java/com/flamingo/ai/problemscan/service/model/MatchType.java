package com.flamingo.ai.problemscan.service.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Coarse classification of how closely a repository problem matches a segment. */
public enum MatchType {
  EXACT("exact"),
  SIMILAR("similar"),
  PARTIAL("partial");

  private final String label;

  MatchType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /**
   * Buckets a similarity score: above {@code exactThreshold} is exact, above {@code
   * similarThreshold} is similar, anything else partial.
   */
  public static MatchType classify(double score, double exactThreshold, double similarThreshold) {
    if (score > exactThreshold) {
      return EXACT;
    }
    if (score > similarThreshold) {
      return SIMILAR;
    }
    return PARTIAL;
  }

  /** Case-insensitive lookup of a label produced by the ranking model. */
  public static Optional<MatchType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.label.equalsIgnoreCase(label.trim())).findFirst();
  }
}
