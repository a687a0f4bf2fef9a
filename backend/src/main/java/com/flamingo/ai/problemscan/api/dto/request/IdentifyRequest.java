package com.flamingo.ai.problemscan.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for identifying a single problem from its text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentifyRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 20000, message = "Text must be at most 20000 characters")
  private String text;
}
