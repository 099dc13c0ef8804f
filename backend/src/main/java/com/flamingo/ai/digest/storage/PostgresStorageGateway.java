package com.flamingo.ai.digest.storage;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.entity.Cluster;
import com.flamingo.ai.digest.domain.entity.ClusterMember;
import com.flamingo.ai.digest.domain.entity.DigestEntry;
import com.flamingo.ai.digest.domain.entity.Item;
import com.flamingo.ai.digest.domain.entity.ItemEmbedding;
import com.flamingo.ai.digest.domain.entity.RawMessage;
import com.flamingo.ai.digest.domain.entity.SummaryCacheEntry;
import com.flamingo.ai.digest.domain.enums.DigestStatus;
import com.flamingo.ai.digest.domain.enums.ItemStatus;
import com.flamingo.ai.digest.domain.model.CanonicalHash;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.domain.repository.ChannelRepository;
import com.flamingo.ai.digest.domain.repository.ClusterMemberRepository;
import com.flamingo.ai.digest.domain.repository.ClusterRepository;
import com.flamingo.ai.digest.domain.repository.DigestEntryRepository;
import com.flamingo.ai.digest.domain.repository.DigestRepository;
import com.flamingo.ai.digest.domain.repository.DropLogRepository;
import com.flamingo.ai.digest.domain.repository.EmbeddingRepository;
import com.flamingo.ai.digest.domain.repository.ItemRepository;
import com.flamingo.ai.digest.domain.repository.RawMessageRepository;
import com.flamingo.ai.digest.domain.repository.SummaryCacheRepository;
import com.flamingo.ai.digest.exception.ItemNotFoundException;
import com.flamingo.ai.digest.exception.ItemNotRetryableException;
import com.flamingo.ai.digest.exception.StorageException;
import com.flamingo.ai.digest.storage.model.CachedEnrichment;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import com.flamingo.ai.digest.storage.model.DigestCandidate;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import com.flamingo.ai.digest.storage.model.ItemDraft;
import com.flamingo.ai.digest.storage.model.ItemErrorView;
import com.flamingo.ai.digest.storage.model.ItemRef;
import com.flamingo.ai.digest.storage.model.NewRawMessage;
import com.flamingo.ai.digest.storage.model.PipelineStats;
import com.flamingo.ai.digest.storage.model.WindowCluster;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link StorageGateway} backed by PostgreSQL with the pgvector extension. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostgresStorageGateway implements StorageGateway {

  /** Distance floor so that a threshold of 1.0 still matches identical vectors. */
  static final double IDENTITY_EPSILON = 1e-6;

  private static final int MAX_ERROR_LENGTH = 2000;

  private final ChannelRepository channelRepository;
  private final RawMessageRepository rawMessageRepository;
  private final ItemRepository itemRepository;
  private final EmbeddingRepository embeddingRepository;
  private final ClusterRepository clusterRepository;
  private final ClusterMemberRepository clusterMemberRepository;
  private final DigestRepository digestRepository;
  private final DigestEntryRepository digestEntryRepository;
  private final SummaryCacheRepository summaryCacheRepository;
  private final DropLogRepository dropLogRepository;
  private final PostgresAdvisoryLocks advisoryLocks;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  @Override
  @Transactional
  public UUID upsertChannel(String username, String title, String context) {
    return execute(
        "upsertChannel",
        () ->
            channelRepository.upsert(
                username, nullToEmpty(title), nullToEmpty(context), clock.instant()));
  }

  @Override
  @Transactional
  public boolean updateChannelImportanceWeight(String username, double weight) {
    int updated =
        execute(
            "updateChannelImportanceWeight",
            () -> channelRepository.updateImportanceWeight(username, weight));
    return updated > 0;
  }

  @Override
  @Transactional
  public Optional<UUID> saveRawMessage(NewRawMessage message) {
    String hash =
        message.canonicalHash() != null
            ? message.canonicalHash()
            : CanonicalHash.of(message.text());
    return execute(
        "saveRawMessage",
        () ->
            rawMessageRepository.insertIfAbsent(
                message.channelId(),
                message.sourceMessageId(),
                message.sourceTimestamp(),
                nullToEmpty(message.text()),
                nullToEmpty(message.entitiesJson()),
                nullToEmpty(message.mediaJson()),
                hash,
                message.forwarded(),
                clock.instant()));
  }

  @Override
  @Transactional
  public List<ClaimedMessage> claimPendingBatch(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return execute(
        "claimPendingBatch",
        () -> {
          List<UUID> ids =
              rawMessageRepository.claimPending(
                  limit, clock.instant(), pipelineConfig.getRetry().getMaxRetries());
          if (ids.isEmpty()) {
            return List.of();
          }
          return rawMessageRepository.findWithChannelByIdIn(ids).stream()
              .map(PostgresStorageGateway::toClaim)
              .toList();
        });
  }

  @Override
  @Transactional
  public void releaseClaim(UUID rawMessageId) {
    execute("releaseClaim", () -> rawMessageRepository.releaseClaim(rawMessageId));
  }

  @Override
  @Transactional
  public void markProcessed(UUID rawMessageId) {
    execute(
        "markProcessed",
        () -> rawMessageRepository.markProcessed(rawMessageId, clock.instant()));
  }

  @Override
  @Transactional
  public int recoverStuckClaims(Duration staleAfter) {
    Instant cutoff = clock.instant().minus(staleAfter);
    return execute("recoverStuckClaims", () -> rawMessageRepository.recoverStuckClaims(cutoff));
  }

  @Override
  @Transactional(readOnly = true)
  public boolean isStrictDuplicate(String canonicalHash, UUID excludeRawMessageId) {
    if (canonicalHash == null || canonicalHash.isEmpty()) {
      return false;
    }
    return execute(
        "isStrictDuplicate",
        () -> rawMessageRepository.existsProcessedWithHash(canonicalHash, excludeRawMessageId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<UUID> findCanonicalItem(String canonicalHash, UUID excludeRawMessageId) {
    if (canonicalHash == null || canonicalHash.isEmpty()) {
      return Optional.empty();
    }
    return execute(
        "findCanonicalItem",
        () -> rawMessageRepository.findCanonicalItemIdByHash(canonicalHash, excludeRawMessageId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ItemRef> findItemRef(UUID itemId) {
    return execute(
        "findItemRef",
        () ->
            itemRepository
                .findById(itemId)
                .map(
                    i ->
                        new ItemRef(
                            i.getId(),
                            i.getStatus(),
                            i.getFirstSeenAt(),
                            i.getDigestedAt() != null)));
  }

  @Override
  @Transactional
  public boolean supersedeItem(UUID itemId, UUID canonicalItemId, String reason) {
    return execute(
        "supersedeItem",
        () -> {
          Instant now = clock.instant();
          Optional<UUID> rawMessageId =
              itemRepository.demoteToDuplicate(itemId, canonicalItemId, now);
          if (rawMessageId.isEmpty()) {
            return false;
          }
          int moved = itemRepository.repointDuplicates(itemId, canonicalItemId, now);
          embeddingRepository.deleteByItemId(itemId);
          dropLogRepository.upsert(
              rawMessageId.get(), reason, "duplicate of item " + canonicalItemId, now);
          log.debug(
              "Item {} superseded by {}, {} duplicates moved over", itemId, canonicalItemId, moved);
          return true;
        });
  }

  @Override
  @Transactional
  public UUID saveItem(ItemDraft draft) {
    return execute(
        "saveItem",
        () -> {
          Instant now = clock.instant();
          UUID rawMessageId = draft.rawMessageId();
          Item item =
              itemRepository
                  .findByRawMessageId(rawMessageId)
                  .orElseGet(
                      () ->
                          Item.builder()
                              .rawMessage(rawMessageRepository.getReferenceById(rawMessageId))
                              .firstSeenAt(draft.firstSeenAt())
                              .retryCount(0)
                              .createdAt(now)
                              .build());
          item.setStatus(draft.status());
          item.setRelevanceScore(draft.relevanceScore());
          item.setImportanceScore(draft.importanceScore());
          item.setTopic(draft.topic());
          item.setSummary(draft.summary());
          item.setLanguage(draft.language());
          item.setDuplicateOfItemId(draft.duplicateOfItemId());
          item.setNextRetryAt(null);
          item.setErrorMessage(null);
          item.setUpdatedAt(now);
          return itemRepository.saveAndFlush(item).getId();
        });
  }

  @Override
  @Transactional
  public int saveItemError(
      UUID rawMessageId, Instant firstSeenAt, String error, boolean permanent) {
    PipelineConfig.Retry retry = pipelineConfig.getRetry();
    int retryFloor = permanent ? retry.getMaxRetries() : 0;
    return execute(
        "saveItemError",
        () ->
            itemRepository.upsertError(
                rawMessageId,
                truncate(error),
                firstSeenAt,
                clock.instant(),
                retry.getBaseBackoff().toSeconds(),
                retry.getMaxBackoff().toSeconds(),
                retryFloor));
  }

  @Override
  @Transactional
  public void saveEmbedding(UUID itemId, float[] vector) {
    execute(
        "saveEmbedding",
        () -> embeddingRepository.upsert(itemId, VectorCodec.toLiteral(vector), clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<UUID> findSimilarItem(float[] vector, double threshold, Instant since) {
    return execute(
        "findSimilarItem",
        () ->
            itemRepository.findNearest(
                VectorCodec.toLiteral(vector), maxDistance(threshold), since));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<UUID> findSimilarItemInChannel(
      float[] vector, UUID channelId, double threshold, Instant since) {
    return execute(
        "findSimilarItemInChannel",
        () ->
            itemRepository.findNearestInChannel(
                VectorCodec.toLiteral(vector), channelId, maxDistance(threshold), since));
  }

  @Override
  @Transactional
  public void recordDrop(UUID rawMessageId, String reason, String detail) {
    execute(
        "recordDrop",
        () -> dropLogRepository.upsert(rawMessageId, reason, nullToEmpty(detail), clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<CachedEnrichment> findCachedEnrichment(
      String canonicalHash, String digestLanguage) {
    return execute(
        "findCachedEnrichment",
        () ->
            summaryCacheRepository
                .findById(new SummaryCacheEntry.Key(canonicalHash, digestLanguage))
                .map(
                    e ->
                        new CachedEnrichment(
                            e.getCanonicalHash(),
                            e.getDigestLanguage(),
                            e.getTopic(),
                            e.getSummary(),
                            e.getLanguage(),
                            e.getRelevanceScore(),
                            e.getImportanceScore())));
  }

  @Override
  @Transactional
  public void upsertCachedEnrichment(CachedEnrichment entry) {
    execute(
        "upsertCachedEnrichment",
        () ->
            summaryCacheRepository.upsert(
                entry.canonicalHash(),
                entry.digestLanguage(),
                nullToEmpty(entry.topic()),
                nullToEmpty(entry.summary()),
                nullToEmpty(entry.language()),
                entry.relevanceScore(),
                entry.importanceScore(),
                clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public List<ClusterCandidate> loadClusterCandidates(
      TimeWindow window, double minImportance, int limit) {
    return execute(
        "loadClusterCandidates",
        () -> {
          List<UUID> ids =
              itemRepository.findClusterCandidateIds(
                  window.start(), window.end(), minImportance, limit);
          if (ids.isEmpty()) {
            return List.of();
          }
          Map<UUID, Item> items = new LinkedHashMap<>();
          itemRepository.findAllById(ids).forEach(item -> items.put(item.getId(), item));
          Map<UUID, ItemEmbedding> embeddings = new LinkedHashMap<>();
          embeddingRepository.findAllById(ids).forEach(e -> embeddings.put(e.getItemId(), e));

          List<ClusterCandidate> candidates = new ArrayList<>(ids.size());
          for (UUID id : ids) {
            Item item = items.get(id);
            ItemEmbedding embedding = embeddings.get(id);
            if (item == null || embedding == null) {
              continue;
            }
            candidates.add(
                new ClusterCandidate(
                    id,
                    item.getTopic(),
                    item.getImportanceScore(),
                    item.getFirstSeenAt(),
                    VectorCodec.fromLiteral(embedding.getVectorText())));
          }
          return candidates;
        });
  }

  @Override
  @Transactional
  public int deleteClustersForWindow(TimeWindow window) {
    return execute(
        "deleteClustersForWindow",
        () -> clusterRepository.deleteByWindow(window.start(), window.end()));
  }

  @Override
  @Transactional
  public UUID createCluster(TimeWindow window, String topic) {
    return execute(
        "createCluster",
        () ->
            clusterRepository
                .saveAndFlush(
                    Cluster.builder()
                        .windowStart(window.start())
                        .windowEnd(window.end())
                        .topic(topic)
                        .createdAt(clock.instant())
                        .build())
                .getId());
  }

  @Override
  @Transactional
  public void addToCluster(UUID clusterId, UUID itemId) {
    execute("addToCluster", () -> clusterMemberRepository.insertIfAbsent(clusterId, itemId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<WindowCluster> loadClusters(TimeWindow window) {
    return execute(
        "loadClusters",
        () -> {
          List<Cluster> clusters =
              clusterRepository.findByWindowStartAndWindowEndOrderByCreatedAtAscIdAsc(
                  window.start(), window.end());
          if (clusters.isEmpty()) {
            return List.of();
          }
          Map<UUID, List<UUID>> members = new LinkedHashMap<>();
          clusters.forEach(c -> members.put(c.getId(), new ArrayList<>()));
          for (ClusterMember member : clusterMemberRepository.findByClusterIdIn(members.keySet())) {
            members.get(member.getClusterId()).add(member.getItemId());
          }
          return clusters.stream()
              .map(
                  c ->
                      new WindowCluster(
                          c.getId(), c.getTopic(), List.copyOf(members.get(c.getId()))))
              .toList();
        });
  }

  @Override
  @Transactional(readOnly = true)
  public List<DigestCandidate> loadDigestCandidates(TimeWindow window, double minImportance) {
    return execute(
        "loadDigestCandidates",
        () -> {
          List<Item> items =
              itemRepository.findUndigestedInWindow(
                  ItemStatus.READY, window.start(), window.end(), minImportance);
          return toCandidates(items);
        });
  }

  @Override
  @Transactional(readOnly = true)
  public List<DigestCandidate> loadDuplicatesOf(Collection<UUID> canonicalItemIds) {
    if (canonicalItemIds.isEmpty()) {
      return List.of();
    }
    return execute(
        "loadDuplicatesOf",
        () ->
            toCandidates(
                itemRepository.findUndigestedDuplicatesOf(canonicalItemIds, ItemStatus.DUPLICATE)));
  }

  @Override
  @Transactional(readOnly = true)
  public boolean digestExists(TimeWindow window, Duration retryGrace) {
    Instant graceCutoff = clock.instant().minus(retryGrace);
    return execute(
        "digestExists",
        () -> digestRepository.existsSettled(window.start(), window.end(), graceCutoff));
  }

  @Override
  @Transactional
  public UUID saveDigest(TimeWindow window, String chatId, String messageId) {
    return execute(
        "saveDigest",
        () ->
            digestRepository.upsertPosted(
                window.start(), window.end(), chatId, messageId, clock.instant()));
  }

  @Override
  @Transactional
  public void saveDigestEntries(UUID digestId, List<DigestEntryDraft> entries) {
    execute(
        "saveDigestEntries",
        () -> {
          digestEntryRepository.deleteByDigestId(digestId);
          Instant now = clock.instant();
          List<DigestEntry> rows = new ArrayList<>(entries.size());
          for (int i = 0; i < entries.size(); i++) {
            DigestEntryDraft draft = entries.get(i);
            rows.add(
                DigestEntry.builder()
                    .digestId(digestId)
                    .position(i)
                    .title(draft.title())
                    .body(draft.body())
                    .sources(new ArrayList<>(draft.sources()))
                    .createdAt(now)
                    .build());
          }
          return digestEntryRepository.saveAllAndFlush(rows).size();
        });
  }

  @Override
  @Transactional
  public void saveDigestError(TimeWindow window, String chatId, String error) {
    execute(
        "saveDigestError",
        () ->
            digestRepository.upsertError(
                window.start(),
                window.end(),
                nullToEmpty(chatId),
                truncate(error),
                clock.instant()));
  }

  @Override
  @Transactional
  public int clearDigestErrors() {
    return execute("clearDigestErrors", digestRepository::deleteErrors);
  }

  @Override
  @Transactional
  public int markItemsDigested(Collection<UUID> itemIds) {
    if (itemIds.isEmpty()) {
      return 0;
    }
    return execute(
        "markItemsDigested", () -> itemRepository.markDigested(itemIds, clock.instant()));
  }

  @Override
  public boolean tryAcquireLock(long lockId) {
    return advisoryLocks.tryAcquire(lockId);
  }

  @Override
  public void releaseLock(long lockId) {
    advisoryLocks.release(lockId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<ItemErrorView> findRecentErrors(int limit) {
    return execute(
        "findRecentErrors",
        () ->
            itemRepository.findRecentByStatus(ItemStatus.ERROR, PageRequest.of(0, limit)).stream()
                .map(
                    i ->
                        new ItemErrorView(
                            i.getId(),
                            i.getRawMessage().getId(),
                            i.getRawMessage().getChannel().getUsername(),
                            i.getRawMessage().getSourceMessageId(),
                            i.getRetryCount(),
                            i.getNextRetryAt(),
                            i.getErrorMessage(),
                            i.getUpdatedAt()))
                .toList());
  }

  @Override
  @Transactional
  public void retryItem(UUID itemId) {
    Item item =
        execute("retryItem", () -> itemRepository.findById(itemId))
            .orElseThrow(() -> new ItemNotFoundException(itemId));
    if (item.getStatus() != ItemStatus.ERROR && item.getStatus() != ItemStatus.RETRY) {
      throw new ItemNotRetryableException(itemId, item.getStatus());
    }
    item.requeue(clock.instant());
    execute("retryItem", () -> itemRepository.save(item));
  }

  @Override
  @Transactional
  public int retryFailedItems() {
    return execute(
        "retryFailedItems",
        () -> itemRepository.requeueAll(ItemStatus.ERROR, ItemStatus.RETRY, clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public PipelineStats loadStats() {
    return execute(
        "loadStats",
        () -> {
          Map<ItemStatus, Long> byStatus = new EnumMap<>(ItemStatus.class);
          for (ItemStatus status : ItemStatus.values()) {
            byStatus.put(status, itemRepository.countByStatus(status));
          }
          return new PipelineStats(
              rawMessageRepository.countByProcessedAtIsNull(),
              rawMessageRepository.countByProcessingStartedAtIsNotNull(),
              byStatus,
              digestRepository.countByStatus(DigestStatus.POSTED),
              digestRepository.countByStatus(DigestStatus.ERROR));
        });
  }

  private List<DigestCandidate> toCandidates(List<Item> items) {
    if (items.isEmpty()) {
      return List.of();
    }
    Set<UUID> withEmbedding =
        new HashSet<>(
            embeddingRepository.findItemIdsWithEmbedding(items.stream().map(Item::getId).toList()));
    return items.stream()
        .map(
            i ->
                new DigestCandidate(
                    i.getId(),
                    i.getRawMessage().getChannel().getUsername(),
                    i.getRawMessage().getSourceMessageId(),
                    i.getTopic(),
                    i.getSummary(),
                    i.getImportanceScore(),
                    i.getFirstSeenAt(),
                    withEmbedding.contains(i.getId()),
                    i.getDuplicateOfItemId()))
        .toList();
  }

  private static ClaimedMessage toClaim(RawMessage message) {
    return new ClaimedMessage(
        message.getId(),
        message.getChannel().getId(),
        message.getChannel().getUsername(),
        message.getChannel().getContext(),
        message.getSourceMessageId(),
        message.getSourceTimestamp(),
        message.getText(),
        message.getCanonicalHash(),
        message.isForwarded(),
        message.getChannel().getImportanceWeight());
  }

  static double maxDistance(double threshold) {
    return Math.max(1.0 - threshold, IDENTITY_EPSILON);
  }

  private static String truncate(String error) {
    if (error == null) {
      return "";
    }
    return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private <T> T execute(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException e) {
      boolean transientFailure =
          e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException;
      log.warn("Storage operation {} failed (transient={}): {}", operation, transientFailure,
          e.getMessage());
      throw new StorageException("Storage operation " + operation + " failed", e, transientFailure);
    }
  }
}
