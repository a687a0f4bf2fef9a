package com.flamingo.ai.problemscan.service.metadata;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Guesses exam type, subject and category from problem text to pre-fill manual entry when no
 * match is found.
 *
 * <p>Each rule table is evaluated in declaration order and the first matching rule wins. Category
 * labels are subdivisions of mathematics, so categories are only looked up when no subject was
 * detected or the subject is Mathematics.
 */
@Service
public class MetadataSuggestionExtractor {

  static final String MATHEMATICS = "Mathematics";

  private static final List<Rule> EXAM_TYPE_RULES =
      List.of(
          rule("AMC10", "AMC\\s*10"),
          rule("AMC12", "AMC\\s*12"),
          rule("AIME", "AIME"),
          rule("MATHCOUNTS", "MATHCOUNTS"),
          rule("SAT", "SAT"),
          rule("AP Calculus", "AP\\s*Calculus"),
          rule("AP Statistics", "AP\\s*Statistics"));

  private static final List<Rule> SUBJECT_RULES =
      List.of(
          rule(MATHEMATICS, "math|algebra|geometry|calculus|trigonometry|statistics"),
          rule("Physics", "physics|mechanics|thermodynamics|electricity"),
          rule("Chemistry", "chemistry|chemical|molecule|reaction"),
          rule("Biology", "biology|cell|organism|genetics"));

  private static final List<Rule> CATEGORY_RULES =
      List.of(
          rule("Algebra", "equation|variable|solve|polynomial"),
          rule("Geometry", "triangle|circle|angle|area|perimeter|volume"),
          rule("Number Theory", "prime|divisible|modular|gcd|lcm"),
          rule("Combinatorics", "permutation|combination|probability|counting"),
          rule("Calculus", "derivative|integral|limit|continuous"));

  /**
   * Extracts suggestions from text.
   *
   * @param text raw OCR or segment text
   * @return suggestion with unmatched fields left null
   */
  public MetadataSuggestion suggest(String text) {
    if (text == null || text.isBlank()) {
      return MetadataSuggestion.empty();
    }

    String examType = firstMatch(EXAM_TYPE_RULES, text);
    String subject = firstMatch(SUBJECT_RULES, text);
    String category =
        subject == null || MATHEMATICS.equals(subject) ? firstMatch(CATEGORY_RULES, text) : null;

    return new MetadataSuggestion(examType, subject, category);
  }

  private static String firstMatch(List<Rule> rules, String text) {
    for (Rule rule : rules) {
      if (rule.pattern().matcher(text).find()) {
        return rule.label();
      }
    }
    return null;
  }

  private static Rule rule(String label, String regex) {
    return new Rule(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
  }

  private record Rule(String label, Pattern pattern) {}
}
