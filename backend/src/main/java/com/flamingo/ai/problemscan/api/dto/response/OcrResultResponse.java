package com.flamingo.ai.problemscan.api.dto.response;

import com.flamingo.ai.problemscan.service.scan.ScanResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the OCR part of a scan. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrResultResponse {

  private boolean success;
  private String text;
  private double confidence;
  private int problemsDetected;
  private List<ProblemSegmentResponse> problems;

  public static OcrResultResponse fromResult(ScanResult result) {
    List<ProblemSegmentResponse> problems =
        result.problems().stream().map(ProblemSegmentResponse::fromSegment).toList();
    return OcrResultResponse.builder()
        .success(result.reading().success())
        .text(result.reading().text())
        .confidence(result.reading().confidence())
        .problemsDetected(problems.size())
        .problems(problems)
        .build();
  }
}
