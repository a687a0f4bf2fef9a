package com.flamingo.ai.problemscan.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j chat models.
 *
 * <p>Both models run at low temperature and without a JSON response format: the segmentation and
 * ranking contracts ask for a bare JSON array, which OpenAI's {@code json_object} mode rejects.
 */
@Configuration
@ConditionalOnProperty(name = "scan.ai.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final ScanConfig scanConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Bean
  public ChatModel segmentationChatModel() {
    return buildModel(scanConfig.getAi().getSegmentationMaxTokens());
  }

  @Bean
  public ChatModel rankingChatModel() {
    return buildModel(scanConfig.getAi().getRankingMaxTokens());
  }

  private ChatModel buildModel(int maxTokens) {
    validateApiKey();
    ScanConfig.Ai ai = scanConfig.getAi();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(ai.getTemperature())
        .maxTokens(maxTokens)
        .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required when scan.ai.enabled=true. "
              + "Set OPENAI_API_KEY or disable AI with SCAN_AI_ENABLED=false.");
    }
  }
}
