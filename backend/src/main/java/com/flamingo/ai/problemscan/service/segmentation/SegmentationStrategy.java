package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.List;

/**
 * One heuristic for splitting OCR text into problems.
 *
 * <p>Strategies are registered as Spring beans and tried by {@link ProblemSegmenter} in {@code
 * @Order} order (ascending). An empty result means the strategy declined and the next one runs.
 */
public interface SegmentationStrategy {

  /**
   * Splits the text into problems.
   *
   * @param text raw OCR text, untrimmed
   * @param bboxes OCR rectangles in reading order, possibly empty
   * @return segments in reading order, or an empty list to decline
   */
  List<ProblemSegment> segment(String text, List<BoundingBox> bboxes);

  /** Short name used in logs and metric tags. */
  String name();
}
