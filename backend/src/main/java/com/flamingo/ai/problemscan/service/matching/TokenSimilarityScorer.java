package com.flamingo.ai.problemscan.service.matching;

import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import com.flamingo.ai.problemscan.service.model.MatchType;
import com.flamingo.ai.problemscan.service.model.ProblemMatch;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Deterministic scorer based on Jaccard similarity of word sets. Always available and never
 * declines, so it terminates the scorer chain.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public class TokenSimilarityScorer implements MatchScorer {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{Alnum}_\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ScanConfig scanConfig;

  @Override
  public Optional<List<ProblemMatch>> score(
      String segmentText, List<CandidateProblem> candidates) {
    ScanConfig.Matching config = scanConfig.getMatching();
    Set<String> segmentTokens = tokenize(segmentText);

    List<ProblemMatch> matches =
        candidates.stream()
            .map(
                candidate -> {
                  double similarity = jaccard(segmentTokens, tokenize(candidate.getContent()));
                  return new ProblemMatch(
                      candidate.getId(),
                      similarity,
                      MatchType.classify(
                          similarity, config.getExactThreshold(), config.getSimilarThreshold()),
                      candidate,
                      null);
                })
            .filter(match -> match.similarityScore() > config.getAcceptanceThreshold())
            .sorted(Comparator.comparingDouble(ProblemMatch::similarityScore).reversed())
            .toList();

    return Optional.of(matches);
  }

  @Override
  public String name() {
    return "token-similarity";
  }

  /** Jaccard similarity of the two texts' token sets; 0 when either set is empty. */
  public static double similarity(String first, String second) {
    return jaccard(tokenize(first), tokenize(second));
  }

  /**
   * Lowercases, replaces punctuation with spaces, splits on whitespace and keeps tokens longer
   * than two characters.
   */
  static Set<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return Arrays.stream(WHITESPACE.split(cleaned))
        .filter(token -> token.length() > 2)
        .collect(Collectors.toSet());
  }

  private static double jaccard(Set<String> first, Set<String> second) {
    if (first.isEmpty() || second.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(first);
    intersection.retainAll(second);
    Set<String> union = new HashSet<>(first);
    union.addAll(second);
    return (double) intersection.size() / union.size();
  }
}
