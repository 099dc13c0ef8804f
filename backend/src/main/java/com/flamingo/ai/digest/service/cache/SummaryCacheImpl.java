package com.flamingo.ai.digest.service.cache;

import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.CachedEnrichment;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Summary cache persisted in the {@code summary_cache} table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryCacheImpl implements SummaryCache {

  private final StorageGateway storageGateway;
  private final MeterRegistry meterRegistry;

  @Override
  public Optional<CachedEnrichment> get(String canonicalHash, String digestLanguage) {
    if (canonicalHash == null || canonicalHash.isEmpty()) {
      return Optional.empty();
    }
    Optional<CachedEnrichment> entry =
        storageGateway.findCachedEnrichment(canonicalHash, digestLanguage);
    if (entry.isPresent()) {
      meterRegistry.counter("enrichment.cache.hit").increment();
      log.debug("Summary cache hit for {} / {}", canonicalHash, digestLanguage);
    }
    return entry;
  }

  @Override
  public void put(CachedEnrichment entry) {
    if (entry.canonicalHash() == null || entry.canonicalHash().isEmpty()) {
      return;
    }
    storageGateway.upsertCachedEnrichment(entry);
  }
}
