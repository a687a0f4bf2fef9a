package com.flamingo.ai.problemscan.service.segmentation;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Splits text at printed problem numbers ("1. ", "Problem 2", "(3)", ...).
 *
 * <p>The numbering convention with the most matches is chosen (see {@link NumberingConvention}).
 * Each match owns the text up to the next match; text before the first match is discarded.
 */
@Component
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class NumberedPatternStrategy implements SegmentationStrategy {

  private final ScanConfig scanConfig;

  @Override
  public List<ProblemSegment> segment(String text, List<BoundingBox> bboxes) {
    NumberingConvention.Selection selection = NumberingConvention.select(text);
    if (selection.matchCount() == 0) {
      return List.of();
    }

    NumberingConvention convention = selection.convention();
    log.debug(
        "Numbering convention '{}' selected with {} matches",
        convention.getLabel(),
        selection.matchCount());

    ScanConfig.Segmentation config = scanConfig.getSegmentation();
    List<ProblemSegment> segments = new ArrayList<>();
    Matcher matcher = convention.getPattern().matcher(text);

    boolean found = matcher.find();
    while (found) {
      Integer number = parseNumber(matcher.group(1));
      int bodyStart = matcher.end();
      found = matcher.find();
      int bodyEnd = found ? matcher.start() : text.length();

      String body = text.substring(bodyStart, bodyEnd).trim();
      if (body.length() <= config.getMinSegmentLength()) {
        log.debug("Dropping short piece after problem {}: '{}'", number, body);
        continue;
      }

      segments.add(
          new ProblemSegment(
              body,
              BoundingBox.atIndex(bboxes, segments.size()),
              config.getNumberedConfidence(),
              number));
    }

    return segments;
  }

  @Override
  public String name() {
    return "numbered";
  }

  private Integer parseNumber(String digits) {
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      log.debug("Problem number '{}' out of range, leaving it unset", digits);
      return null;
    }
  }
}
