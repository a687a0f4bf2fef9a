package com.flamingo.ai.problemscan.api.dto.response;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import com.flamingo.ai.problemscan.service.scan.Identification;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for identifying a single problem text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentifyResponse {

  private List<MatchResponse> matches;
  private MetadataSuggestion suggestions;

  public static IdentifyResponse fromIdentification(Identification identification, int limit) {
    return IdentifyResponse.builder()
        .matches(
            identification.matches().stream().limit(limit).map(MatchResponse::fromMatch).toList())
        .suggestions(identification.suggestions())
        .build();
  }
}
