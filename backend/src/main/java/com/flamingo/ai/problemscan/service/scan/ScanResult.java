package com.flamingo.ai.problemscan.service.scan;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import com.flamingo.ai.problemscan.service.model.OcrReading;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.List;

/**
 * Outcome of scanning one worksheet image.
 *
 * @param reading the OCR reading the pipeline ran on
 * @param segments detected problems with their matches, in reading order
 * @param suggestions metadata guessed from the full OCR text
 */
public record ScanResult(
    OcrReading reading, List<SegmentMatches> segments, MetadataSuggestion suggestions) {

  public List<ProblemSegment> problems() {
    return segments.stream().map(SegmentMatches::segment).toList();
  }
}
