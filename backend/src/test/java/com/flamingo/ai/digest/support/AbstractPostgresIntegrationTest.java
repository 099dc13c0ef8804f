package com.flamingo.ai.digest.support;

import com.flamingo.ai.digest.service.digest.DigestPublisher;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Base class for tests against a real PostgreSQL with pgvector. External model and transport beans
 * are mocked, workers stay off, and time is driven through {@link MutableClock}.
 */
@SpringBootTest(properties = {"pipeline.worker.enabled=false", "logging.level.com.flamingo=DEBUG"})
@Testcontainers(disabledWithoutDocker = true)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@Import(AbstractPostgresIntegrationTest.ClockConfig.class)
public abstract class AbstractPostgresIntegrationTest {

  protected static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
  protected static final int DIMENSIONS = 1536;

  @Container @ServiceConnection
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  // External dependencies that need API keys or a running chat gateway
  @MockitoBean protected ChatModel chatModel;
  @MockitoBean protected EmbeddingModel embeddingModel;
  @MockitoBean protected DigestPublisher digestPublisher;

  @Autowired protected MutableClock clock;
  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void resetDatabase() {
    jdbcTemplate.execute(
        "TRUNCATE raw_message_drop_log, summary_cache, digest_entries, digests, cluster_members,"
            + " clusters, embeddings, items, raw_messages, channels CASCADE");
    clock.setInstant(START);
  }

  /** A full-width vector whose leading components are {@code head}. */
  protected static float[] vector(float... head) {
    return Arrays.copyOf(head, DIMENSIONS);
  }

  @TestConfiguration
  static class ClockConfig {

    @Bean
    @Primary
    MutableClock testClock() {
      return new MutableClock(START);
    }
  }
}
