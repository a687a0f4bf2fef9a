package com.flamingo.ai.problemscan.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import com.flamingo.ai.problemscan.service.model.MatchType;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a repository problem matched against a scanned problem. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResponse {

  private String problemId;
  private double similarityScore;
  private MatchType matchType;
  private String reasoning;
  private String title;
  private String subject;
  private String category;
  private String examType;
  private Integer examYear;
  private Integer problemNumber;

  public static MatchResponse fromMatch(ProblemMatch match) {
    MatchResponseBuilder builder =
        MatchResponse.builder()
            .problemId(match.problemId())
            .similarityScore(match.similarityScore())
            .matchType(match.matchType())
            .reasoning(match.reasoning());
    CandidateProblem problem = match.problem();
    if (problem != null) {
      builder
          .title(problem.getTitle())
          .subject(problem.getSubject())
          .category(problem.getCategory())
          .examType(problem.getExamType())
          .examYear(problem.getExamYear())
          .problemNumber(problem.getProblemNumber());
    }
    return builder.build();
  }
}
