package com.flamingo.ai.problemscan.service.matching;

import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import java.util.List;
import java.util.Optional;

/**
 * Scores candidates against a segment. Scorers are tried by {@link ProblemMatcher} in {@code
 * @Order} order until one produces a result.
 */
public interface MatchScorer {

  /**
   * Scores the candidates.
   *
   * @param segmentText text of one detected problem
   * @param candidates non-empty candidate list from retrieval
   * @return accepted matches sorted by score descending (possibly empty), or {@link
   *     Optional#empty()} when this scorer could not produce a result and the next should run
   */
  Optional<List<ProblemMatch>> score(String segmentText, List<CandidateProblem> candidates);

  /** Short name used in logs and metric tags. */
  String name();
}
