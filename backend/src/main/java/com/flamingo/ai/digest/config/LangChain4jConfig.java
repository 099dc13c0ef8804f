package com.flamingo.ai.digest.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j enrichment and embedding models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:1024}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  public ChatModel chatModel(PipelineConfig pipelineConfig) {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(pipelineConfig.getWorker().getProviderTimeout())
        .responseFormat("json_object")
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
