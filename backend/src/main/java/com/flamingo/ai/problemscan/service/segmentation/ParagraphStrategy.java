package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Treats each blank-line separated paragraph of sufficient length as one problem. Unbroken text is
 * a single paragraph.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class ParagraphStrategy implements SegmentationStrategy {

  private static final Pattern BLANK_LINE = Pattern.compile("\\r?\\n(?:[ \\t]*\\r?\\n)+");

  private final ScanConfig scanConfig;

  @Override
  public List<ProblemSegment> segment(String text, List<BoundingBox> bboxes) {
    ScanConfig.Segmentation config = scanConfig.getSegmentation();
    String[] paragraphs = BLANK_LINE.split(text.trim());
    List<ProblemSegment> segments = new ArrayList<>();
    for (String paragraph : paragraphs) {
      String trimmed = paragraph.trim();
      if (trimmed.length() <= config.getMinParagraphLength()) {
        continue;
      }
      int index = segments.size();
      segments.add(
          new ProblemSegment(
              trimmed,
              BoundingBox.atIndex(bboxes, index),
              config.getParagraphConfidence(),
              index + 1));
    }

    return segments;
  }

  @Override
  public String name() {
    return "paragraph";
  }
}
