package com.flamingo.ai.problemscan.service.segmentation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.problemscan.agent.ProblemSegmentationAgent;
import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.exception.LlmServiceException;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * LLM-based segmentation. Preferred over the regex chain because it copes with unnumbered,
 * oddly formatted and multi-column worksheets.
 *
 * <p>The reply must be a JSON array of {@code {problemNumber, text, confidence}}. Any call failure,
 * parse error or schema violation rejects the whole reply and yields an empty list; nothing is
 * salvaged from a partially valid array.
 */
@Service
@ConditionalOnProperty(name = "scan.ai.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AiProblemSegmenter {

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private final ProblemSegmentationAgent agent;
  private final ObjectMapper objectMapper;
  private final ScanConfig scanConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Segments OCR text with the LLM.
   *
   * @param text raw OCR text
   * @return segments without bounding boxes, or an empty list on any failure
   */
  @Timed(value = "scan.segmentation.ai", description = "Time for AI segmentation")
  public List<ProblemSegment> segmentWithAI(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    try {
      String reply = callAgent(text);
      List<ProblemSegment> segments = parseSegments(reply);
      log.debug("AI segmentation returned {} segments", segments.size());
      return segments;
    } catch (LlmServiceException e) {
      String reason = e.isMalformedResponse() ? "malformed" : "unavailable";
      log.warn("AI segmentation failed ({}): {}", reason, e.getMessage());
      meterRegistry.counter("scan.segmentation.ai.failures", "reason", reason).increment();
      return List.of();
    }
  }

  private String callAgent(String text) {
    try {
      return agent.segment(text);
    } catch (RuntimeException e) {
      throw new LlmServiceException("Segmentation call failed: " + e.getMessage(), e);
    }
  }

  /**
   * Validates and maps a segmentation reply. Code fences around the array are tolerated;
   * anything else that is not a JSON array of well-formed elements is rejected.
   */
  List<ProblemSegment> parseSegments(String reply) {
    if (reply == null || reply.isBlank()) {
      throw LlmServiceException.malformed("Empty segmentation reply");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(reply.trim()));
    } catch (JsonProcessingException e) {
      throw LlmServiceException.malformed("Segmentation reply is not JSON: " + e.getOriginalMessage());
    }
    if (root == null || !root.isArray()) {
      throw LlmServiceException.malformed("Segmentation reply is not a JSON array");
    }

    int minLength = scanConfig.getSegmentation().getMinSegmentLength();
    List<ProblemSegment> segments = new ArrayList<>();
    for (JsonNode element : root) {
      ProblemSegment segment = toSegment(element);
      if (segment.text().length() > minLength) {
        segments.add(segment);
      }
    }
    return segments;
  }

  private ProblemSegment toSegment(JsonNode element) {
    if (!element.isObject()) {
      throw LlmServiceException.malformed("Segment element is not an object: " + element);
    }

    JsonNode text = element.get("text");
    if (text == null || !text.isTextual()) {
      throw LlmServiceException.malformed("Segment element without text: " + element);
    }

    JsonNode confidence = element.get("confidence");
    if (confidence == null || !confidence.isNumber()) {
      throw LlmServiceException.malformed("Segment element without numeric confidence");
    }

    Integer problemNumber = null;
    JsonNode number = element.get("problemNumber");
    if (number != null && !number.isNull()) {
      if (!number.canConvertToInt() || !number.isIntegralNumber()) {
        throw LlmServiceException.malformed("problemNumber is not an integer: " + number);
      }
      problemNumber = number.intValue();
    }

    double clamped = Math.max(0.0, Math.min(1.0, confidence.doubleValue()));
    return new ProblemSegment(text.asText().trim(), BoundingBox.ZERO, clamped, problemNumber);
  }

  private String stripCodeFence(String reply) {
    Matcher matcher = CODE_FENCE.matcher(reply);
    return matcher.matches() ? matcher.group(1) : reply;
  }
}
