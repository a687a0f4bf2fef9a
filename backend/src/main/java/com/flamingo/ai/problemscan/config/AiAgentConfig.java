package com.flamingo.ai.problemscan.config;

import com.flamingo.ai.problemscan.agent.ProblemRankingAgent;
import com.flamingo.ai.problemscan.agent.ProblemSegmentationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Agents return the raw completion text; callers own JSON parsing and validation so that a
 * malformed reply can be rejected as a whole.
 */
@Configuration
@ConditionalOnProperty(name = "scan.ai.enabled", havingValue = "true", matchIfMissing = true)
public class AiAgentConfig {

  /** Splits OCR text into individual problems. */
  @Bean
  public ProblemSegmentationAgent problemSegmentationAgent(
      @Qualifier("segmentationChatModel") ChatModel segmentationChatModel) {
    return AiServices.builder(ProblemSegmentationAgent.class)
        .chatModel(segmentationChatModel)
        .build();
  }

  /** Ranks repository candidates against a detected problem. */
  @Bean
  public ProblemRankingAgent problemRankingAgent(
      @Qualifier("rankingChatModel") ChatModel rankingChatModel) {
    return AiServices.builder(ProblemRankingAgent.class).chatModel(rankingChatModel).build();
  }
}
