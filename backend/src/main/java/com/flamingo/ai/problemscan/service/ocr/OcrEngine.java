package com.flamingo.ai.problemscan.service.ocr;

import com.flamingo.ai.problemscan.service.model.OcrReading;

/**
 * Capability for turning an image into text. Implementations never throw for upstream failures;
 * they report them as {@link OcrReading#failed()}.
 */
public interface OcrEngine {

  /**
   * Recognizes the text in an image.
   *
   * @param image raw image bytes
   * @param filename original file name, forwarded to the OCR service
   * @return the reading, {@code success=false} when the service could not be used
   */
  OcrReading recognize(byte[] image, String filename);

  /**
   * Probes the OCR service.
   *
   * @return {@code true} if the service answered its health endpoint with 200
   */
  boolean isHealthy();
}
