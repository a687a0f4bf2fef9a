package com.flamingo.ai.problemscan.service.model;

import java.util.List;

/**
 * Text recognized from one worksheet image.
 *
 * @param success whether the OCR service produced a usable result
 * @param text raw recognized text, never null
 * @param confidence recognition confidence in [0, 1]
 * @param bboxes text region rectangles in reading order
 */
public record OcrReading(
    boolean success, String text, double confidence, List<BoundingBox> bboxes) {

  public OcrReading {
    text = text == null ? "" : text;
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    bboxes = bboxes == null ? List.of() : List.copyOf(bboxes);
  }

  /** Result used whenever the OCR service is unreachable, times out or answers non-2xx. */
  public static OcrReading failed() {
    return new OcrReading(false, "", 0.0, List.of());
  }
}
