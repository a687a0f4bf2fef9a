package com.flamingo.ai.problemscan.service.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("MatchType Tests")
class MatchTypeTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({"0.95, EXACT", "0.9, SIMILAR", "0.75, SIMILAR", "0.7, PARTIAL", "0.35, PARTIAL"})
  @DisplayName("Should bucket scores with strict thresholds")
  void shouldBucketScores(double score, MatchType expected) {
    assertThat(MatchType.classify(score, 0.9, 0.7)).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should resolve labels case-insensitively")
  void shouldResolveLabels() {
    assertThat(MatchType.fromLabel("Exact")).contains(MatchType.EXACT);
    assertThat(MatchType.fromLabel(" partial ")).contains(MatchType.PARTIAL);
    assertThat(MatchType.fromLabel("identical")).isEmpty();
    assertThat(MatchType.fromLabel(null)).isEmpty();
  }
}
