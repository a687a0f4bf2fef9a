package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for problem detection. AI segmentation is tried first when available; the regex
 * chain is the always-available baseline and runs only when the AI path returns nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentationService {

  private final Optional<AiProblemSegmenter> aiProblemSegmenter;
  private final ProblemSegmenter problemSegmenter;
  private final ScanConfig scanConfig;
  private final MeterRegistry meterRegistry;

  /** Runs the regex chain only. */
  public List<ProblemSegment> detectProblems(String text, List<BoundingBox> bboxes) {
    return problemSegmenter.segment(text, bboxes);
  }

  /**
   * Detects problems, preferring AI segmentation.
   *
   * @param text raw OCR text
   * @param bboxes OCR rectangles, used by the regex chain only
   * @return detected problems in reading order
   */
  public List<ProblemSegment> detectProblemsEnhanced(String text, List<BoundingBox> bboxes) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    if (scanConfig.getSegmentation().isAiEnabled() && aiProblemSegmenter.isPresent()) {
      List<ProblemSegment> aiSegments = aiProblemSegmenter.get().segmentWithAI(text);
      if (!aiSegments.isEmpty()) {
        meterRegistry.counter("scan.segmentation.strategy", "strategy", "ai").increment();
        return aiSegments;
      }
      log.info("AI segmentation returned nothing, falling back to regex segmentation");
    }

    return detectProblems(text, bboxes);
  }
}
