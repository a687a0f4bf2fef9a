package com.flamingo.ai.problemscan.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumberingConvention Tests")
class NumberingConventionTest {

  @Test
  @DisplayName("Should pick the convention with the most matches")
  void shouldPickConventionWithMostMatches() {
    String text =
        "(1) Compute the sum of the first ten primes. "
            + "(2) Find the area of the shaded region. "
            + "(3) How many integers divide 360? "
            + "4. Trailing note about grading.";

    NumberingConvention.Selection selection = NumberingConvention.select(text);

    assertThat(selection.convention()).isEqualTo(NumberingConvention.PARENTHESIZED);
    assertThat(selection.matchCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should prefer the earlier declared convention on an exact tie")
  void shouldPreferEarlierConventionOnTie() {
    String text = "1. First problem statement (1) 2. Second problem statement (2)";

    assertThat(NumberingConvention.DOTTED.countMatches(text)).isEqualTo(2);
    assertThat(NumberingConvention.PARENTHESIZED.countMatches(text)).isEqualTo(2);
    assertThat(NumberingConvention.select(text).convention())
        .isEqualTo(NumberingConvention.DOTTED);
  }

  @Test
  @DisplayName("Should report zero matches for unnumbered text")
  void shouldReportZeroMatchesForUnnumberedText() {
    NumberingConvention.Selection selection =
        NumberingConvention.select("Find all real x such that x squared equals nine");

    assertThat(selection.matchCount()).isZero();
  }

  @Test
  @DisplayName("Should match word conventions case-insensitively")
  void shouldMatchWordConventionsCaseInsensitively() {
    String text = "PROBLEM 1 something problem 2 something Problem3 something";

    assertThat(NumberingConvention.PROBLEM_WORD.countMatches(text)).isEqualTo(3);
    assertThat(NumberingConvention.select(text).convention())
        .isEqualTo(NumberingConvention.PROBLEM_WORD);
  }

  @Test
  @DisplayName("Should not count decimals as dotted numbering")
  void shouldNotCountDecimalsAsDottedNumbering() {
    assertThat(NumberingConvention.DOTTED.countMatches("The answer is 3.5 meters")).isZero();
  }

  @Test
  @DisplayName("Should not count parenthesized numbers as closing-paren numbering")
  void shouldNotCountParenthesizedAsClosingParen() {
    assertThat(NumberingConvention.CLOSING_PAREN.countMatches("(1) a (2) b")).isZero();
    assertThat(NumberingConvention.CLOSING_PAREN.countMatches("1) a 2) b")).isEqualTo(2);
  }
}
