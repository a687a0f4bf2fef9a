package com.flamingo.ai.problemscan.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for scanning a base64-encoded image. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageDataRequest {

  public static final String DEFAULT_FILENAME = "upload.jpg";

  @NotBlank(message = "No image data provided")
  private String imageData;

  private String filename;

  public String filenameOrDefault() {
    return filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename;
  }
}
