package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Regex-based segmentation chain. Runs the registered {@link SegmentationStrategy} beans in {@code
 * @Order} order and returns the first non-empty result:
 *
 * <ol>
 *   <li>{@link NumberedPatternStrategy} - printed problem numbers
 *   <li>{@link ParagraphStrategy} - blank-line paragraphs
 *   <li>{@link SingleBlockStrategy} - whole text
 * </ol>
 *
 * <p>Never throws; blank text yields an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProblemSegmenter {

  private final List<SegmentationStrategy> strategies;
  private final MeterRegistry meterRegistry;

  /**
   * Splits OCR text into problems.
   *
   * @param text raw OCR text
   * @param bboxes OCR rectangles in reading order
   * @return detected problems, empty only when the text is blank
   */
  public List<ProblemSegment> segment(String text, List<BoundingBox> bboxes) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<BoundingBox> boxes = bboxes == null ? List.of() : bboxes;

    for (SegmentationStrategy strategy : strategies) {
      List<ProblemSegment> segments = strategy.segment(text, boxes);
      if (!segments.isEmpty()) {
        log.debug("Strategy '{}' produced {} segments", strategy.name(), segments.size());
        meterRegistry.counter("scan.segmentation.strategy", "strategy", strategy.name()).increment();
        return segments;
      }
      log.debug("Strategy '{}' declined", strategy.name());
    }

    return List.of();
  }
}
