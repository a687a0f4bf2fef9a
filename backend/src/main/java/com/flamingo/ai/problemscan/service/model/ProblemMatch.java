package com.flamingo.ai.problemscan.service.model;

/**
 * A repository problem scored against one segment.
 *
 * @param problemId id of the matched repository problem
 * @param similarityScore score in [0, 1]
 * @param matchType coarse bucket of the score
 * @param problem the matched candidate
 * @param reasoning model explanation, null for the deterministic scorer
 */
public record ProblemMatch(
    String problemId,
    double similarityScore,
    MatchType matchType,
    CandidateProblem problem,
    String reasoning) {}
