package com.flamingo.ai.problemscan.service.segmentation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Problem index conventions found on worksheets, in priority order. When two conventions match
 * equally often the one declared first wins.
 *
 * <p>Every pattern captures the printed number in group 1.
 */
public enum NumberingConvention {
  DOTTED("N. ", Pattern.compile("(?<!\\d)(\\d+)\\.\\s")),
  PROBLEM_WORD("Problem N", Pattern.compile("Problem\\s*(\\d+)", Pattern.CASE_INSENSITIVE)),
  QUESTION_WORD("Question N", Pattern.compile("Question\\s*(\\d+)", Pattern.CASE_INSENSITIVE)),
  PARENTHESIZED("(N)", Pattern.compile("\\((\\d+)\\)")),
  CLOSING_PAREN("N)", Pattern.compile("(?<![(\\d])(\\d+)\\)\\s")),
  BRACKETED("[N]", Pattern.compile("\\[(\\d+)\\]")),
  HASH("#N", Pattern.compile("#(\\d+)"));

  private final String label;
  private final Pattern pattern;

  NumberingConvention(String label, Pattern pattern) {
    this.label = label;
    this.pattern = pattern;
  }

  public String getLabel() {
    return label;
  }

  public Pattern getPattern() {
    return pattern;
  }

  /** Counts non-overlapping occurrences across the whole text. */
  public int countMatches(String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  /**
   * Picks the convention with the most matches; ties go to the earliest declared.
   *
   * @return the winner and its count, with a count of 0 when nothing matched
   */
  public static Selection select(String text) {
    NumberingConvention best = values()[0];
    int bestCount = 0;
    for (NumberingConvention convention : values()) {
      int count = convention.countMatches(text);
      if (count > bestCount) {
        best = convention;
        bestCount = count;
      }
    }
    return new Selection(best, bestCount);
  }

  /** Winning convention and how often it matched. */
  public record Selection(NumberingConvention convention, int matchCount) {}
}
