package com.flamingo.ai.problemscan.service.matching;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Two-stage matching: full-text retrieval of candidates, then scoring by the first {@link
 * MatchScorer} in {@code @Order} order that produces a result ({@link AiMatchScorer} when AI is
 * enabled, then {@link TokenSimilarityScorer}).
 *
 * <p>Scorer failures are contained here. Retrieval failures propagate to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProblemMatcher {

  private final CandidateRetriever candidateRetriever;
  private final List<MatchScorer> scorers;
  private final ScanConfig scanConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Finds repository problems matching one detected problem.
   *
   * @param segmentText text of the detected problem
   * @param tenantId tenant whose repository is searched
   * @return matches sorted by similarity descending, empty when nothing relevant exists
   */
  @Timed(value = "scan.matching", description = "Time to match one segment")
  public List<ProblemMatch> findMatches(String segmentText, String tenantId) {
    List<CandidateProblem> candidates =
        candidateRetriever.search(
            segmentText, tenantId, scanConfig.getMatching().getCandidateLimit());

    if (candidates.isEmpty()) {
      log.debug("No candidates for tenant {}, skipping scoring", tenantId);
      return List.of();
    }

    for (MatchScorer scorer : scorers) {
      Optional<List<ProblemMatch>> result = tryScore(scorer, segmentText, candidates);
      if (result.isPresent()) {
        meterRegistry.counter("scan.matching.scorer", "scorer", scorer.name()).increment();
        log.debug(
            "Scorer '{}' kept {} of {} candidates",
            scorer.name(),
            result.get().size(),
            candidates.size());
        return result.get();
      }
    }

    log.warn("No scorer produced a result for {} candidates", candidates.size());
    return List.of();
  }

  private Optional<List<ProblemMatch>> tryScore(
      MatchScorer scorer, String segmentText, List<CandidateProblem> candidates) {
    try {
      return scorer.score(segmentText, candidates);
    } catch (RuntimeException e) {
      log.warn("Scorer '{}' failed, trying next: {}", scorer.name(), e.getMessage());
      return Optional.empty();
    }
  }
}
