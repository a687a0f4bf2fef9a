package com.flamingo.ai.problemscan.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.problemscan.agent.ProblemSegmentationAgent;
import com.flamingo.ai.problemscan.config.ScanConfig;
import com.flamingo.ai.problemscan.service.model.BoundingBox;
import com.flamingo.ai.problemscan.service.model.ProblemSegment;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SegmentationService Tests")
class SegmentationServiceTest {

  private static final String TEXT =
      "1. What is 2+2? (A) 3 (B) 4 (C) 5 2. What is 3+3? (A) 5 (B) 6 (C) 9";

  @Mock private ProblemSegmentationAgent agent;

  private ScanConfig scanConfig;
  private SimpleMeterRegistry meterRegistry;
  private ProblemSegmenter problemSegmenter;
  private SegmentationService service;

  @BeforeEach
  void setUp() {
    scanConfig = new ScanConfig();
    meterRegistry = new SimpleMeterRegistry();
    problemSegmenter =
        new ProblemSegmenter(
            List.of(
                new NumberedPatternStrategy(scanConfig),
                new ParagraphStrategy(scanConfig),
                new SingleBlockStrategy(scanConfig)),
            meterRegistry);
    AiProblemSegmenter aiSegmenter =
        new AiProblemSegmenter(agent, new ObjectMapper(), scanConfig, meterRegistry);
    service =
        new SegmentationService(
            Optional.of(aiSegmenter), problemSegmenter, scanConfig, meterRegistry);
  }

  @Test
  @DisplayName("Should use AI segments when the reply is valid")
  void shouldUseAiSegmentsWhenValid() {
    when(agent.segment(TEXT))
        .thenReturn("[{\"problemNumber\": 7, \"text\": \"What is 2+2 and 3+3?\", \"confidence\": 1}]");

    List<ProblemSegment> segments = service.detectProblemsEnhanced(TEXT, List.of());

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).problemNumber()).isEqualTo(7);
    assertThat(meterRegistry.counter("scan.segmentation.strategy", "strategy", "ai").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should produce the regex chain result when the AI reply is malformed")
  void shouldFallBackToRegexChainOnMalformedReply() {
    when(agent.segment(TEXT)).thenReturn("[{\"problemNumber\": 1, \"text\": ");
    List<BoundingBox> boxes = List.of(new BoundingBox(1, 2, 3, 4));

    List<ProblemSegment> enhanced = service.detectProblemsEnhanced(TEXT, boxes);
    List<ProblemSegment> regexOnly = problemSegmenter.segment(TEXT, boxes);

    assertThat(enhanced).isEqualTo(regexOnly);
    assertThat(enhanced).extracting(ProblemSegment::problemNumber).containsExactly(1, 2);
  }

  @Test
  @DisplayName("Should fall back when AI returns an empty array")
  void shouldFallBackWhenAiReturnsEmptyArray() {
    when(agent.segment(TEXT)).thenReturn("[]");

    assertThat(service.detectProblemsEnhanced(TEXT, List.of())).hasSize(2);
  }

  @Test
  @DisplayName("Should skip AI when disabled in configuration")
  void shouldSkipAiWhenDisabled() {
    scanConfig.getSegmentation().setAiEnabled(false);

    assertThat(service.detectProblemsEnhanced(TEXT, List.of())).hasSize(2);
    verify(agent, never()).segment(anyString());
  }

  @Test
  @DisplayName("Should run the regex chain when no AI segmenter is registered")
  void shouldRunRegexChainWithoutAiSegmenter() {
    SegmentationService regexOnly =
        new SegmentationService(Optional.empty(), problemSegmenter, scanConfig, meterRegistry);

    assertThat(regexOnly.detectProblemsEnhanced(TEXT, List.of())).hasSize(2);
  }

  @Test
  @DisplayName("Should return no segments for blank text without calling AI")
  void shouldReturnEmptyForBlankText() {
    assertThat(service.detectProblemsEnhanced(" \n ", List.of())).isEmpty();
    verify(agent, never()).segment(anyString());
  }
}
