package com.flamingo.ai.problemscan.service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored problem returned by full-text search. Read-only to the scanning pipeline; the importer
 * that writes the {@code problems} index owns its lifecycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateProblem {

  private String id;
  private String tenantId;
  private String title;
  private String content;
  private String subject;
  private String category;
  private String examType;
  private Integer examYear;
  private Integer problemNumber;
  private String difficulty;

  // Relevance score from the search engine (set by search methods)
  @Builder.Default private Double relevanceScore = 0.0;
}
