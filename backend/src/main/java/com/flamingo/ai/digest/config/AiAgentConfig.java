package com.flamingo.ai.digest.config;

import com.flamingo.ai.digest.agent.MessageEnrichmentAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts with {@code @SystemMessage}/{@code @UserMessage}; the
 * concrete implementation is generated by {@code AiServices.builder()}.
 */
@Configuration
public class AiAgentConfig {

  /** Scores, summarizes and labels a single channel message in one structured call. */
  @Bean
  public MessageEnrichmentAgent messageEnrichmentAgent(ChatModel chatModel) {
    return AiServices.builder(MessageEnrichmentAgent.class).chatModel(chatModel).build();
  }
}
