package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Last resort: the whole text is one problem. Declines only for blank text. */
@Component
@Order(30)
@RequiredArgsConstructor
public class SingleBlockStrategy implements SegmentationStrategy {

  private final ScanConfig scanConfig;

  @Override
  public List<ProblemSegment> segment(String text, List<BoundingBox> bboxes) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return List.of(
        new ProblemSegment(
            trimmed, BoundingBox.ZERO, scanConfig.getSegmentation().getSingleBlockConfidence(), 1));
  }

  @Override
  public String name() {
    return "single-block";
  }
}
