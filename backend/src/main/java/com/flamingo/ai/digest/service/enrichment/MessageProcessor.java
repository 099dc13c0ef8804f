package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.enums.FilteredMessageMode;
import com.flamingo.ai.digest.domain.enums.ItemStatus;
import com.flamingo.ai.digest.exception.EnrichmentException;
import com.flamingo.ai.digest.service.cache.SummaryCache;
import com.flamingo.ai.digest.service.dedup.DeduplicationEngine;
import com.flamingo.ai.digest.service.dedup.DuplicateDecision;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.CachedEnrichment;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import com.flamingo.ai.digest.storage.model.ItemDraft;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Takes one claimed message through filter, cache, enrichment, embedding and deduplication, and
 * writes its terminal state.
 *
 * <p>Every path except a transient provider failure ends with the message marked processed. A
 * transient failure records the error and releases the claim instead. Storage failures propagate
 * to the worker loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageProcessor {

  private final StorageGateway storageGateway;
  private final MessageFilter messageFilter;
  private final SummaryCache summaryCache;
  private final EnrichmentProvider enrichmentProvider;
  private final EmbeddingService embeddingService;
  private final DeduplicationEngine deduplicationEngine;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  @Timed(value = "enrichment.message", description = "Time to process one claimed message")
  public ProcessingOutcome process(ClaimedMessage message) {
    FilterDecision filter = messageFilter.evaluate(message);
    if (filter.filtered()) {
      return handleFiltered(message, filter);
    }

    String digestLanguage = pipelineConfig.getEnrichment().getDigestLanguage();
    Optional<CachedEnrichment> cached = summaryCache.get(message.canonicalHash(), digestLanguage);

    EnrichmentResult result;
    if (cached.isPresent()) {
      CachedEnrichment entry = cached.get();
      result =
          new EnrichmentResult(
              entry.topic(),
              entry.summary(),
              entry.language(),
              entry.relevanceScore(),
              entry.importanceScore());
    } else {
      try {
        result =
            enrichmentProvider.enrich(
                new EnrichmentRequest(
                    message.channelUsername(),
                    message.channelContext(),
                    digestLanguage,
                    message.text()));
      } catch (EnrichmentException e) {
        return handleEnrichmentFailure(message, e);
      }
    }

    ProcessingOutcome outcome = complete(message, result);

    if (cached.isEmpty()) {
      summaryCache.put(
          new CachedEnrichment(
              message.canonicalHash(),
              digestLanguage,
              result.topic(),
              result.summary(),
              result.language(),
              result.relevance(),
              result.importance()));
    }
    return outcome;
  }

  private ProcessingOutcome complete(ClaimedMessage message, EnrichmentResult result) {
    if (result.relevance() < pipelineConfig.getEnrichment().getMinRelevance()) {
      ItemDraft rejected = draft(message, ItemStatus.REJECTED, result);
      transactionTemplate.executeWithoutResult(
          status -> {
            storageGateway.saveItem(rejected);
            storageGateway.markProcessed(message.rawMessageId());
          });
      log.debug("Message {} rejected, relevance {}", message.rawMessageId(), result.relevance());
      meterRegistry.counter("enrichment.messages.rejected").increment();
      return ProcessingOutcome.REJECTED;
    }

    DuplicateDecision decision = deduplicationEngine.checkStrict(message);
    float[] vector = new float[0];
    if (!decision.duplicate()) {
      vector = embeddingService.embed(message.text());
      if (!decision.supersedes()) {
        decision = deduplicationEngine.checkSemantic(message, vector);
      }
    }

    ItemDraft ready = draft(message, ItemStatus.READY, result);
    DuplicateDecision finalDecision = decision;
    float[] finalVector = vector;

    ProcessingOutcome outcome =
        transactionTemplate.execute(
            status -> {
              if (finalDecision.duplicate()) {
                storeDuplicate(message, ready, finalDecision.canonicalItemId(), finalDecision);
                return ProcessingOutcome.DUPLICATE;
              }
              UUID itemId = storageGateway.saveItem(ready);
              if (finalDecision.supersedes()
                  && !storageGateway.supersedeItem(
                      finalDecision.supersededItemId(), itemId, finalDecision.reason())) {
                // The later item was digested in the meantime and stays canonical.
                storeDuplicate(message, ready, finalDecision.supersededItemId(), finalDecision);
                return ProcessingOutcome.DUPLICATE;
              }
              if (finalVector.length > 0) {
                storageGateway.saveEmbedding(itemId, finalVector);
              }
              storageGateway.markProcessed(message.rawMessageId());
              return ProcessingOutcome.READY;
            });

    if (outcome == ProcessingOutcome.DUPLICATE) {
      meterRegistry.counter("enrichment.messages.duplicate").increment();
      return outcome;
    }
    if (decision.supersedes()) {
      log.info(
          "Message {} replaced later item {} as canonical ({})",
          message.rawMessageId(),
          decision.supersededItemId(),
          decision.reason());
    }
    if (vector.length == 0) {
      log.warn("Item for message {} stored without embedding", message.rawMessageId());
    }
    meterRegistry.counter("enrichment.messages.ready").increment();
    return ProcessingOutcome.READY;
  }

  private void storeDuplicate(
      ClaimedMessage message, ItemDraft ready, UUID canonicalItemId, DuplicateDecision decision) {
    storageGateway.saveItem(ready.withDuplicateOf(canonicalItemId));
    storageGateway.recordDrop(
        message.rawMessageId(), decision.reason(), "duplicate of item " + canonicalItemId);
    storageGateway.markProcessed(message.rawMessageId());
  }

  private ProcessingOutcome handleFiltered(ClaimedMessage message, FilterDecision filter) {
    FilteredMessageMode mode = pipelineConfig.getEnrichment().getFilteredMode();
    log.debug("Message {} filtered ({}), mode {}", message.rawMessageId(), filter.reason(), mode);
    transactionTemplate.executeWithoutResult(
        status -> {
          if (mode == FilteredMessageMode.DROP_LOG) {
            storageGateway.recordDrop(message.rawMessageId(), filter.reason(), "");
          } else {
            storageGateway.saveItem(
                new ItemDraft(
                    message.rawMessageId(),
                    ItemStatus.READY,
                    0.0,
                    0.0,
                    "",
                    "",
                    "",
                    message.sourceTimestamp(),
                    null));
          }
          storageGateway.markProcessed(message.rawMessageId());
        });
    meterRegistry.counter("enrichment.messages.filtered", "reason", filter.reason()).increment();
    return ProcessingOutcome.FILTERED;
  }

  private ProcessingOutcome handleEnrichmentFailure(ClaimedMessage message, EnrichmentException e) {
    boolean permanent = !e.isRetryable();
    String error = e.getKind() + ": " + e.getMessage();
    int maxRetries = pipelineConfig.getRetry().getMaxRetries();

    if (permanent) {
      transactionTemplate.executeWithoutResult(
          status -> {
            storageGateway.saveItemError(
                message.rawMessageId(), message.sourceTimestamp(), error, true);
            storageGateway.markProcessed(message.rawMessageId());
          });
      log.error("Enrichment failed permanently for message {}: {}", message.rawMessageId(), error);
      meterRegistry.counter("enrichment.errors.permanent").increment();
      return ProcessingOutcome.FAILED;
    }

    // The last allowed failure and the completion commit together; the claim query never
    // returns a message whose retries are exhausted.
    int retries =
        transactionTemplate.execute(
            status -> {
              int count =
                  storageGateway.saveItemError(
                      message.rawMessageId(), message.sourceTimestamp(), error, false);
              if (count >= maxRetries) {
                storageGateway.markProcessed(message.rawMessageId());
              }
              return count;
            });
    if (retries >= maxRetries) {
      log.error(
          "Message {} exhausted {} retries, giving up: {}", message.rawMessageId(), retries, error);
      meterRegistry.counter("enrichment.errors.poison").increment();
      return ProcessingOutcome.FAILED;
    }
    storageGateway.releaseClaim(message.rawMessageId());
    log.warn(
        "Enrichment failed for message {} (attempt {}/{}): {}",
        message.rawMessageId(),
        retries,
        maxRetries,
        error);
    meterRegistry.counter("enrichment.errors.transient", "kind", e.getKind().name()).increment();
    return ProcessingOutcome.RETRY_SCHEDULED;
  }

  private static ItemDraft draft(ClaimedMessage message, ItemStatus status, EnrichmentResult r) {
    return new ItemDraft(
        message.rawMessageId(),
        status,
        r.relevance(),
        ImportanceWeighting.apply(r.importance(), message.channelImportanceWeight()),
        r.topic(),
        r.summary(),
        r.language(),
        message.sourceTimestamp(),
        null);
  }
}
