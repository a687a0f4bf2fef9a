package com.flamingo.ai.problemscan.service.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.problemscan.service.model.MetadataSuggestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataSuggestionExtractor Tests")
class MetadataSuggestionExtractorTest {

  private final MetadataSuggestionExtractor extractor = new MetadataSuggestionExtractor();

  @Test
  @DisplayName("Should detect exam type, subject and category together")
  void shouldDetectAllFields() {
    MetadataSuggestion suggestion =
        extractor.suggest("AMC 10 2019 algebra: Solve the equation x^2 = 4");

    assertThat(suggestion.examType()).isEqualTo("AMC10");
    assertThat(suggestion.subject()).isEqualTo("Mathematics");
    assertThat(suggestion.category()).isEqualTo("Algebra");
  }

  @Test
  @DisplayName("Should detect a category when no subject is found")
  void shouldDetectCategoryWithoutSubject() {
    MetadataSuggestion suggestion = extractor.suggest("Find the derivative of f(x) = x^3");

    assertThat(suggestion.examType()).isNull();
    assertThat(suggestion.subject()).isNull();
    assertThat(suggestion.category()).isEqualTo("Calculus");
  }

  @Test
  @DisplayName("Should not assign a math category to a non-math subject")
  void shouldNotAssignCategoryToOtherSubjects() {
    MetadataSuggestion suggestion =
        extractor.suggest("A physics question: find the area of the charged plate");

    assertThat(suggestion.subject()).isEqualTo("Physics");
    assertThat(suggestion.category()).isNull();
  }

  @Test
  @DisplayName("Should apply the first matching rule in declaration order")
  void shouldApplyFirstMatchingRule() {
    MetadataSuggestion suggestion =
        extractor.suggest("What is the probability that a random prime is odd?");

    assertThat(suggestion.category()).isEqualTo("Number Theory");
  }

  @Test
  @DisplayName("Should match exam names case-insensitively with optional spacing")
  void shouldMatchExamNamesLoosely() {
    assertThat(extractor.suggest("amc12 problem 5").examType()).isEqualTo("AMC12");
    assertThat(extractor.suggest("From the AP Calculus exam").examType())
        .isEqualTo("AP Calculus");
  }

  @Test
  @DisplayName("Should return an empty suggestion for blank text")
  void shouldReturnEmptyForBlankText() {
    assertThat(extractor.suggest("   ")).isEqualTo(MetadataSuggestion.empty());
    assertThat(extractor.suggest(null)).isEqualTo(MetadataSuggestion.empty());
  }
}
