package com.flamingo.ai.digest.service.digest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.DigestSource;
import com.flamingo.ai.digest.exception.DigestPublishException;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Posts digests as JSON to a chat gateway webhook. The gateway answers with the chat and message id
 * of the delivered post.
 */
@Component
@Slf4j
public class WebhookDigestPublisher implements DigestPublisher {

  private final WebClient webClient;
  private final String path;
  private final Duration timeout;

  public WebhookDigestPublisher(PipelineConfig pipelineConfig) {
    PipelineConfig.Digest digest = pipelineConfig.getDigest();
    this.path = digest.getWebhookPath();
    this.timeout = digest.getPublishTimeout();
    this.webClient =
        WebClient.builder()
            .baseUrl(digest.getWebhookUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Digest webhook publisher initialized: url={}{}", digest.getWebhookUrl(), path);
  }

  @Override
  public PublishReceipt publish(String chatId, List<DigestEntryDraft> entries) {
    var request = new PublishRequest(chatId, entries.stream().map(EntryJson::from).toList());
    PublishResponse response;
    try {
      response =
          webClient
              .post()
              .uri(path)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(PublishResponse.class)
              .timeout(timeout)
              .block();
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      boolean transientFailure = status == 429 || status == 408 || status >= 500;
      throw new DigestPublishException(
          "Webhook answered " + status + ": " + e.getResponseBodyAsString(), e, transientFailure);
    } catch (WebClientRequestException e) {
      throw new DigestPublishException("Webhook unreachable: " + e.getMessage(), e, true);
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof TimeoutException) {
        throw new DigestPublishException("Webhook timed out after " + timeout, e, true);
      }
      throw e;
    }

    if (response == null || response.messageId() == null || response.messageId().isBlank()) {
      throw new DigestPublishException("Webhook returned no message id", false);
    }
    String deliveredChat =
        response.chatId() == null || response.chatId().isBlank() ? chatId : response.chatId();
    return new PublishReceipt(deliveredChat, response.messageId());
  }

  record PublishRequest(@JsonProperty("chat_id") String chatId, List<EntryJson> entries) {}

  record EntryJson(String title, String body, List<SourceJson> sources) {
    static EntryJson from(DigestEntryDraft draft) {
      return new EntryJson(
          draft.title(), draft.body(), draft.sources().stream().map(SourceJson::from).toList());
    }
  }

  record SourceJson(String channel, @JsonProperty("msg_id") long msgId) {
    static SourceJson from(DigestSource source) {
      return new SourceJson(source.channel(), source.msgId());
    }
  }

  record PublishResponse(
      @JsonProperty("chat_id") String chatId, @JsonProperty("message_id") String messageId) {}
}
