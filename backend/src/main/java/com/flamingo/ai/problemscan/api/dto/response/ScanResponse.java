package com.flamingo.ai.problemscan.api.dto.response;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import com.flamingo.ai.problemscan.service.scan.ScanResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a scanned worksheet image. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {

  private OcrResultResponse ocrResult;
  private List<SegmentMatchesResponse> segments;
  private MetadataSuggestion suggestions;
  private int detectedProblems;

  /**
   * Creates a ScanResponse from a pipeline result.
   *
   * @param topMatches maximum number of matches reported per problem
   */
  public static ScanResponse fromResult(ScanResult result, int topMatches) {
    return ScanResponse.builder()
        .ocrResult(OcrResultResponse.fromResult(result))
        .segments(
            result.segments().stream()
                .map(s -> SegmentMatchesResponse.fromSegmentMatches(s, topMatches))
                .toList())
        .suggestions(result.suggestions())
        .detectedProblems(result.segments().size())
        .build();
  }
}
