package com.flamingo.ai.problemscan.service.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.problemscan.agent.ProblemRankingAgent;
import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.exception.LlmServiceException;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import com.flamingo.ai.problemscan.service.model.MatchType;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * LLM-based ranking of retrieved candidates. The model returns {@code {problem_id,
 * similarity_score, match_type, reasoning}} per match and chooses the match type itself.
 *
 * <p>Ids that are not among the candidates are dropped. Any call failure or malformed element
 * rejects the whole reply, and the scorer declines so that {@link TokenSimilarityScorer} runs.
 */
@Service
@Order(1)
@ConditionalOnProperty(name = "scan.ai.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AiMatchScorer implements MatchScorer {

  private final ProblemRankingAgent agent;
  private final ObjectMapper objectMapper;
  private final ScanConfig scanConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "scan.matching.ai", description = "Time for AI candidate ranking")
  public Optional<List<ProblemMatch>> score(
      String segmentText, List<CandidateProblem> candidates) {
    try {
      String reply = callAgent(buildPrompt(segmentText, candidates));
      List<ProblemMatch> matches = parseMatches(reply, candidates);
      log.debug("AI ranking accepted {} of {} candidates", matches.size(), candidates.size());
      return Optional.of(matches);
    } catch (LlmServiceException e) {
      String reason = e.isMalformedResponse() ? "malformed" : "unavailable";
      log.warn("AI ranking failed ({}), falling back: {}", reason, e.getMessage());
      meterRegistry.counter("scan.matching.ai.fallback", "reason", reason).increment();
      return Optional.empty();
    }
  }

  @Override
  public String name() {
    return "ai";
  }

  private String callAgent(String prompt) {
    try {
      return agent.rank(prompt);
    } catch (RuntimeException e) {
      throw new LlmServiceException("Ranking call failed: " + e.getMessage(), e);
    }
  }

  String buildPrompt(String segmentText, List<CandidateProblem> candidates) {
    int excerptLength = scanConfig.getMatching().getExcerptLength();
    StringBuilder sb = new StringBuilder();
    sb.append("Input Problem Text:\n\"").append(segmentText).append("\"\n\n");
    sb.append("Candidate Problems:\n");

    for (int i = 0; i < candidates.size(); i++) {
      CandidateProblem problem = candidates.get(i);
      String content = problem.getContent() == null ? "" : problem.getContent();
      if (content.length() > excerptLength) {
        content = content.substring(0, excerptLength);
      }

      sb.append(i + 1).append(". ID: ").append(problem.getId()).append("\n");
      sb.append("   Title: ").append(problem.getTitle()).append("\n");
      sb.append("   Content: ").append(content).append("...\n");
      sb.append("   Subject: ")
          .append(problem.getSubject())
          .append(", Category: ")
          .append(problem.getCategory())
          .append("\n\n");
    }

    sb.append("Return a JSON array with one object per match:\n");
    sb.append("[\n");
    sb.append("  {\n");
    sb.append("    \"problem_id\": \"<candidate ID>\",\n");
    sb.append("    \"similarity_score\": 0.95,\n");
    sb.append("    \"match_type\": \"exact|similar|partial\",\n");
    sb.append("    \"reasoning\": \"brief explanation\"\n");
    sb.append("  }\n");
    sb.append("]\n\n");
    sb.append("similarity_score is on a 0-1 scale. Only include matches with similarity_score > ")
        .append(scanConfig.getMatching().getAcceptanceThreshold())
        .append(". Order by similarity score (highest first). Respond with the JSON array only.");

    return sb.toString();
  }

  /**
   * Extracts the JSON array (first {@code [} to last {@code ]}) from the reply and maps it to
   * matches. Throws {@link LlmServiceException} if any element is malformed.
   */
  List<ProblemMatch> parseMatches(String reply, List<CandidateProblem> candidates) {
    JsonNode root = readArray(reply);
    Map<String, CandidateProblem> byId =
        candidates.stream()
            .filter(c -> c.getId() != null)
            .collect(
                Collectors.toMap(
                    CandidateProblem::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    double threshold = scanConfig.getMatching().getAcceptanceThreshold();

    List<ProblemMatch> matches = new ArrayList<>();
    for (JsonNode element : root) {
      ProblemMatch match = toMatch(element, byId);
      if (match == null) {
        continue;
      }
      if (match.similarityScore() > threshold) {
        matches.add(match);
      }
    }

    matches.sort(Comparator.comparingDouble(ProblemMatch::similarityScore).reversed());
    return matches;
  }

  private JsonNode readArray(String reply) {
    if (reply == null) {
      throw LlmServiceException.malformed("Empty ranking reply");
    }
    int start = reply.indexOf('[');
    int end = reply.lastIndexOf(']');
    if (start < 0 || end < start) {
      throw LlmServiceException.malformed("No JSON array in ranking reply");
    }

    try {
      JsonNode root = objectMapper.readTree(reply.substring(start, end + 1));
      if (root == null || !root.isArray()) {
        throw LlmServiceException.malformed("Ranking reply is not a JSON array");
      }
      return root;
    } catch (JsonProcessingException e) {
      throw LlmServiceException.malformed("Ranking reply is not JSON: " + e.getOriginalMessage());
    }
  }

  /** Returns null for hallucinated ids; throws for schema violations. */
  private ProblemMatch toMatch(JsonNode element, Map<String, CandidateProblem> byId) {
    if (!element.isObject()) {
      throw LlmServiceException.malformed("Match element is not an object: " + element);
    }

    JsonNode id = element.get("problem_id");
    if (id == null || !(id.isTextual() || id.isIntegralNumber())) {
      throw LlmServiceException.malformed("Match element without problem_id: " + element);
    }

    JsonNode score = element.get("similarity_score");
    if (score == null || !score.isNumber()) {
      throw LlmServiceException.malformed("Match element without numeric similarity_score");
    }
    double value = score.doubleValue();
    if (value < 0.0 || value > 1.0) {
      throw LlmServiceException.malformed("similarity_score out of range: " + value);
    }

    JsonNode type = element.get("match_type");
    MatchType matchType =
        MatchType.fromLabel(type == null || !type.isTextual() ? null : type.asText())
            .orElseThrow(() -> LlmServiceException.malformed("Unknown match_type: " + type));

    CandidateProblem problem = byId.get(id.asText());
    if (problem == null) {
      log.debug("Dropping match for unknown problem id {}", id.asText());
      return null;
    }

    JsonNode reasoning = element.get("reasoning");
    return new ProblemMatch(
        problem.getId(),
        value,
        matchType,
        problem,
        reasoning != null && reasoning.isTextual() ? reasoning.asText() : null);
  }
}
