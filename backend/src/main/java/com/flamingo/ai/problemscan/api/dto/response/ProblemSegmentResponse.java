package com.flamingo.ai.problemscan.api.dto.response;

import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one detected problem. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProblemSegmentResponse {

  private Integer problemNumber;
  private String text;
  private List<Double> bbox;
  private double confidence;

  public static ProblemSegmentResponse fromSegment(ProblemSegment segment) {
    return ProblemSegmentResponse.builder()
        .problemNumber(segment.problemNumber())
        .text(segment.text())
        .bbox(segment.boundingBox().toList())
        .confidence(segment.confidence())
        .build();
  }
}
