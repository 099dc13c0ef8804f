package com.flamingo.ai.digest.agent;

import com.flamingo.ai.digest.agent.dto.MessageEnrichmentResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns one channel message into a digest-ready item: relevance and importance
 * scores, a short topic label and a one-sentence summary in the digest language.
 */
public interface MessageEnrichmentAgent {

  @SystemMessage(
      """
        You are an editor preparing a news digest from channel posts. Read the message and return
        a JSON object with these fields:

        1. "topic": a 2-5 word label of what the message is about, in {{language}}.
        2. "summary": one sentence (max 200 characters) stating the key fact, in {{language}}.
           Do not start with "The message" or "This post".
        3. "language": the ISO 639-1 code of the original message.
        4. "relevance": number from 0.0 to 1.0. How much real news content the message carries.
           Ads, greetings, polls and chatter score below 0.2.
        5. "importance": number from 0.0 to 1.0. How much a general reader should care today.

        Return ONLY valid JSON matching this structure:
        {"topic": "...", "summary": "...", "language": "..", "relevance": 0.0, "importance": 0.0}
        """)
  @UserMessage(
      """
        Channel: {{channel}}
        Channel context: {{context}}
        Language hint: {{hint}}

        Message:
        {{text}}
        """)
  MessageEnrichmentResult enrich(
      @V("channel") String channel,
      @V("context") String context,
      @V("hint") String languageHint,
      @V("language") String language,
      @V("text") String text);
}
