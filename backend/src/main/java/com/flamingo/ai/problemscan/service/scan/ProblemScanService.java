package com.flamingo.ai.problemscan.service.scan;

import com.flamingo.ai.problemscan.service.model.OcrReading;

/** Service interface for the worksheet scanning pipeline. */
public interface ProblemScanService {

  /**
   * Runs OCR on an image, detects the problems on it and matches each against the repository.
   *
   * @throws com.flamingo.ai.problemscan.exception.OcrProcessingException if OCR failed
   */
  ScanResult scan(byte[] image, String filename, String tenantId);

  /** Runs segmentation and matching on an existing OCR reading. */
  ScanResult process(OcrReading reading, String tenantId);

  /** Matches a single problem text without segmenting it. */
  Identification identifyProblem(String text, String tenantId);

  /** Whether the OCR service is reachable. */
  boolean isOcrAvailable();
}
