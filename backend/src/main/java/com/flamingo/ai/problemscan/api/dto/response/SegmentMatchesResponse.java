package com.flamingo.ai.problemscan.api.dto.response;

import com.flamingo.ai.problemscan.service.scan.SegmentMatches;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO pairing a detected problem with its best matches. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentMatchesResponse {

  private ProblemSegmentResponse segment;
  private List<MatchResponse> matches;
  private boolean lookupFailed;

  public static SegmentMatchesResponse fromSegmentMatches(SegmentMatches matched, int limit) {
    return SegmentMatchesResponse.builder()
        .segment(ProblemSegmentResponse.fromSegment(matched.segment()))
        .matches(matched.matches().stream().limit(limit).map(MatchResponse::fromMatch).toList())
        .lookupFailed(matched.lookupFailed())
        .build();
  }
}
