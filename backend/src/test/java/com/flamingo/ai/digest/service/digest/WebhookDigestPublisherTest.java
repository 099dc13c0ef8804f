package com.flamingo.ai.digest.service.digest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.DigestSource;
import com.flamingo.ai.digest.exception.DigestPublishException;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WebhookDigestPublisher Tests")
class WebhookDigestPublisherTest {

  private static final List<DigestEntryDraft> ENTRIES =
      List.of(
          new DigestEntryDraft(
              "Interest rates",
              "• Rates went up.",
              List.of(new DigestSource("newsroom", 42L), new DigestSource("wire", 7L))));

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AtomicReference<String> requestBody = new AtomicReference<>();

  private HttpServer httpServer;
  private PipelineConfig config;

  @BeforeEach
  void setUp() throws IOException {
    httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    httpServer.start();
    config = new PipelineConfig();
    config.getDigest()
        .setWebhookUrl(
            "http://"
                + httpServer.getAddress().getHostString()
                + ":"
                + httpServer.getAddress().getPort());
    config.getDigest().setPublishTimeout(Duration.ofMillis(500));
  }

  @AfterEach
  void tearDown() {
    httpServer.stop(0);
  }

  @Test
  @DisplayName("Should post the digest as JSON and return the delivered message id")
  void shouldPublish() throws IOException {
    respondWith(200, "{\"chat_id\":\"@digest\",\"message_id\":\"555\"}");

    PublishReceipt receipt = new WebhookDigestPublisher(config).publish("@digest", ENTRIES);

    assertThat(receipt.chatId()).isEqualTo("@digest");
    assertThat(receipt.messageId()).isEqualTo("555");
    JsonNode body = objectMapper.readTree(requestBody.get());
    assertThat(body.path("chat_id").asText()).isEqualTo("@digest");
    JsonNode entry = body.path("entries").get(0);
    assertThat(entry.path("title").asText()).isEqualTo("Interest rates");
    assertThat(entry.path("sources").get(1).path("channel").asText()).isEqualTo("wire");
    assertThat(entry.path("sources").get(1).path("msg_id").asLong()).isEqualTo(7L);
  }

  @Test
  @DisplayName("Should treat server errors as transient")
  void shouldMapServerErrorToTransient() {
    respondWith(503, "{\"error\":\"unavailable\"}");

    assertThatThrownBy(() -> new WebhookDigestPublisher(config).publish("@digest", ENTRIES))
        .isInstanceOf(DigestPublishException.class)
        .satisfies(e -> assertThat(((DigestPublishException) e).isTransient()).isTrue());
  }

  @Test
  @DisplayName("Should treat a rejected request as permanent")
  void shouldMapClientErrorToPermanent() {
    respondWith(400, "{\"error\":\"chat not found\"}");

    assertThatThrownBy(() -> new WebhookDigestPublisher(config).publish("@digest", ENTRIES))
        .isInstanceOf(DigestPublishException.class)
        .satisfies(e -> assertThat(((DigestPublishException) e).isTransient()).isFalse())
        .hasMessageContaining("400");
  }

  @Test
  @DisplayName("Should fail when the gateway returns no message id")
  void shouldRequireMessageId() {
    respondWith(200, "{\"chat_id\":\"@digest\"}");

    assertThatThrownBy(() -> new WebhookDigestPublisher(config).publish("@digest", ENTRIES))
        .isInstanceOf(DigestPublishException.class)
        .hasMessageContaining("no message id");
  }

  @Test
  @DisplayName("Should time out as a transient failure")
  void shouldTimeOut() {
    httpServer.createContext(
        "/digests",
        exchange -> {
          try {
            Thread.sleep(2_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          respondJson(exchange, 200, "{\"message_id\":\"late\"}");
        });

    assertThatThrownBy(() -> new WebhookDigestPublisher(config).publish("@digest", ENTRIES))
        .isInstanceOf(DigestPublishException.class)
        .satisfies(e -> assertThat(((DigestPublishException) e).isTransient()).isTrue())
        .hasMessageContaining("timed out");
  }

  private void respondWith(int status, String json) {
    httpServer.createContext(
        "/digests",
        exchange -> {
          requestBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          respondJson(exchange, status, json);
        });
  }

  private static void respondJson(HttpExchange exchange, int status, String json)
      throws IOException {
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
