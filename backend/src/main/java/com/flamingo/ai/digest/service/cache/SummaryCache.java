package com.flamingo.ai.digest.service.cache;

import com.flamingo.ai.digest.storage.model.CachedEnrichment;
import java.util.Optional;

/**
 * Content-addressed store of enrichment outputs keyed by canonical hash and digest language.
 * Embeddings are never cached.
 */
public interface SummaryCache {

  /** Returns the entry for the key, or empty when nothing was cached for it. */
  Optional<CachedEnrichment> get(String canonicalHash, String digestLanguage);

  /** Stores the entry; the last write for a key wins. */
  void put(CachedEnrichment entry);
}
