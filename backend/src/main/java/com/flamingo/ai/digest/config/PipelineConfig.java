package com.flamingo.ai.digest.config;

import com.flamingo.ai.digest.domain.enums.FilteredMessageMode;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the enrichment and digest pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Worker worker = new Worker();
  private Retry retry = new Retry();
  private Enrichment enrichment = new Enrichment();
  private Filter filter = new Filter();
  private Dedup dedup = new Dedup();
  private Clustering clustering = new Clustering();
  private Digest digest = new Digest();

  @PostConstruct
  void validate() {
    requireUnitInterval("pipeline.dedup.global-similarity", dedup.getGlobalSimilarity());
    requireUnitInterval("pipeline.dedup.intra-similarity", dedup.getIntraSimilarity());
    requireUnitInterval("pipeline.clustering.similarity", clustering.getSimilarity());
    requireUnitInterval("pipeline.digest.importance-threshold", digest.getImportanceThreshold());
    if (dedup.getGlobalSimilarity() < dedup.getIntraSimilarity()) {
      throw new IllegalStateException(
          "pipeline.dedup.global-similarity must not be lower than intra-similarity");
    }
    if (dedup.getGlobalWindow().compareTo(dedup.getIntraWindow()) < 0) {
      throw new IllegalStateException(
          "pipeline.dedup.global-window must not be shorter than intra-window");
    }
    if (worker.getBatchSize() < 1 || worker.getWorkers() < 1 || worker.getFanOut() < 1) {
      throw new IllegalStateException("pipeline.worker sizes must be positive");
    }
    if (digest.getWindow().isZero() || digest.getWindow().isNegative()) {
      throw new IllegalStateException("pipeline.digest.window must be positive");
    }
    if (retry.getMaxRetries() < 1) {
      throw new IllegalStateException("pipeline.retry.max-retries must be positive");
    }
  }

  private static void requireUnitInterval(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(name + " must be within [0, 1], got " + value);
    }
  }

  @Getter
  @Setter
  public static class Worker {
    /** Start the claim loops when the application is ready. */
    private boolean enabled = true;

    private int workers = 4;
    private int batchSize = 10;

    /** Messages of one claimed batch processed concurrently. */
    private int fanOut = 4;

    private Duration idleBackoff = Duration.ofSeconds(10);
    private Duration staleClaimAfter = Duration.ofMinutes(10);
    private Duration recoveryInterval = Duration.ofMinutes(1);

    /** Upper bound for one enrichment provider call. */
    private Duration providerTimeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxRetries = 5;
    private Duration baseBackoff = Duration.ofMinutes(1);
    private Duration maxBackoff = Duration.ofHours(6);
  }

  @Getter
  @Setter
  public static class Enrichment {
    /** Items below this relevance are neither embedded nor deduplicated. */
    private double minRelevance = 0.0;

    private String digestLanguage = "en";
    private FilteredMessageMode filteredMode = FilteredMessageMode.ZERO_RELEVANCE;
    private int maxInputChars = 4000;

    /** Width of the stored vectors; provider output is padded or truncated to it. */
    private int embeddingDimensions = 1536;
  }

  @Getter
  @Setter
  public static class Filter {
    private int minLength = 20;
    private boolean adsEnabled = true;
    private List<String> adsKeywords =
        new ArrayList<>(List.of("#ad", "sponsored", "promo", "giveaway", "use my code"));
    private List<String> denyPatterns = new ArrayList<>();
    private List<String> allowPatterns = new ArrayList<>();

    /** One of mixed, allowlist, denylist. */
    private String mode = "mixed";

    private boolean suppressForwards = false;
  }

  @Getter
  @Setter
  public static class Dedup {
    private double globalSimilarity = 0.92;
    private Duration globalWindow = Duration.ofHours(36);
    private double intraSimilarity = 0.88;
    private Duration intraWindow = Duration.ofHours(6);
  }

  @Getter
  @Setter
  public static class Clustering {
    private double similarity = 0.82;
    private int maxClusterSize = 10;
    private int maxItems = 500;
  }

  @Getter
  @Setter
  public static class Digest {
    private double importanceThreshold = 0.3;
    private Duration retryGrace = Duration.ofHours(1);
    private String chatId = "";
    private String webhookUrl = "http://localhost:8090";
    private String webhookPath = "/digests";
    private Duration publishTimeout = Duration.ofSeconds(30);

    /** Publish the last completed window on a fixed delay. */
    private boolean schedulerEnabled = false;

    /** Window length; windows are aligned to multiples of it since the epoch. */
    private Duration window = Duration.ofHours(1);

    private Duration schedulerInterval = Duration.ofMinutes(5);
  }
}
