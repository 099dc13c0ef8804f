package com.flamingo.ai.digest.service.digest;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.DigestSource;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.exception.DigestPublishException;
import com.flamingo.ai.digest.exception.StorageException;
import com.flamingo.ai.digest.service.clustering.ClusteringService;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.DigestCandidate;
import com.flamingo.ai.digest.storage.model.DigestEntryDraft;
import com.flamingo.ai.digest.storage.model.WindowCluster;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds and publishes the digest of one window, at most once.
 *
 * <p>Assembly is serialized across instances by an advisory lock on the window. The window's
 * clusters are rebuilt under that lock, and only while no digest exists for it. The publish call
 * happens before anything is written; on success the digest row, its entries and the digested
 * markers are written in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DigestAssembler {

  static final String BULLET = "• ";

  private static final int PERSIST_ATTEMPTS = 3;

  private static final Comparator<DigestCandidate> MEMBER_ORDER =
      Comparator.comparingDouble(DigestCandidate::importanceScore)
          .reversed()
          .thenComparing(DigestCandidate::firstSeenAt)
          .thenComparing(DigestCandidate::itemId);

  private final StorageGateway storageGateway;
  private final ClusteringService clusteringService;
  private final DigestPublisher digestPublisher;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  @Timed(value = "digest.assemble", description = "Time to assemble and publish a digest")
  public DigestRunResult assemble(TimeWindow window, String chatId) {
    long lockKey = window.lockKey();
    if (!storageGateway.tryAcquireLock(lockKey)) {
      log.info("Digest for window {} is being assembled elsewhere", window);
      meterRegistry.counter("digest.skipped", "reason", "locked").increment();
      return DigestRunResult.skipped(window, DigestRunResult.Status.LOCKED);
    }
    try {
      return assembleLocked(window, chatId);
    } finally {
      storageGateway.releaseLock(lockKey);
    }
  }

  private DigestRunResult assembleLocked(TimeWindow window, String chatId) {
    PipelineConfig.Digest config = pipelineConfig.getDigest();
    if (storageGateway.digestExists(window, config.getRetryGrace())) {
      log.debug("Digest for window {} already exists", window);
      meterRegistry.counter("digest.skipped", "reason", "exists").increment();
      return DigestRunResult.skipped(window, DigestRunResult.Status.ALREADY_EXISTS);
    }

    clusteringService.rebuild(window);
    List<PlannedEntry> plan = plan(window, config.getImportanceThreshold());
    if (plan.isEmpty()) {
      log.info("Nothing to publish for window {}", window);
      meterRegistry.counter("digest.skipped", "reason", "empty").increment();
      return DigestRunResult.skipped(window, DigestRunResult.Status.NOTHING_TO_PUBLISH);
    }
    List<DigestEntryDraft> entries = plan.stream().map(PlannedEntry::entry).toList();
    List<UUID> itemIds = plan.stream().flatMap(p -> p.itemIds().stream()).toList();

    PublishReceipt receipt;
    try {
      receipt = digestPublisher.publish(chatId, entries);
    } catch (DigestPublishException e) {
      log.error(
          "Publishing digest for window {} failed (transient={}): {}",
          window,
          e.isTransient(),
          e.getMessage());
      storageGateway.saveDigestError(window, chatId, e.getMessage());
      meterRegistry.counter("digest.failed").increment();
      return new DigestRunResult(
          window, DigestRunResult.Status.FAILED, null, entries.size(), e.getMessage());
    }

    UUID digestId = persist(window, receipt, entries, itemIds);
    log.info(
        "Published digest {} for window {}: {} entries, {} items, message {}",
        digestId,
        window,
        entries.size(),
        itemIds.size(),
        receipt.messageId());
    meterRegistry.counter("digest.published").increment();
    return new DigestRunResult(
        window, DigestRunResult.Status.POSTED, digestId, entries.size(), null);
  }

  /** The writes are idempotent, so a transient failure after publishing is retried in place. */
  private UUID persist(
      TimeWindow window, PublishReceipt receipt, List<DigestEntryDraft> entries, List<UUID> ids) {
    StorageException last = null;
    for (int attempt = 1; attempt <= PERSIST_ATTEMPTS; attempt++) {
      try {
        return transactionTemplate.execute(
            status -> {
              UUID digestId =
                  storageGateway.saveDigest(window, receipt.chatId(), receipt.messageId());
              storageGateway.saveDigestEntries(digestId, entries);
              storageGateway.markItemsDigested(ids);
              return digestId;
            });
      } catch (StorageException e) {
        if (!e.isTransient()) {
          throw e;
        }
        last = e;
        log.warn(
            "Recording digest for window {} failed (attempt {}/{}): {}",
            window,
            attempt,
            PERSIST_ATTEMPTS,
            e.getMessage());
      }
    }
    throw last;
  }

  List<PlannedEntry> plan(TimeWindow window, double importanceThreshold) {
    List<DigestCandidate> candidates =
        storageGateway.loadDigestCandidates(window, importanceThreshold).stream()
            .filter(c -> c.summary() != null && !c.summary().isBlank())
            .toList();
    if (candidates.isEmpty()) {
      return List.of();
    }
    Map<UUID, DigestCandidate> byId = new LinkedHashMap<>();
    candidates.forEach(c -> byId.put(c.itemId(), c));

    List<Group> groups = new ArrayList<>();
    Set<UUID> assigned = new HashSet<>();
    for (WindowCluster cluster : storageGateway.loadClusters(window)) {
      List<DigestCandidate> members = new ArrayList<>();
      for (UUID itemId : cluster.itemIds()) {
        DigestCandidate candidate = byId.get(itemId);
        if (candidate != null && assigned.add(itemId)) {
          members.add(candidate);
        }
      }
      if (!members.isEmpty()) {
        groups.add(new Group(cluster.topic(), members));
      }
    }
    // Unclustered items, including those without an embedding, become their own entry
    for (DigestCandidate candidate : candidates) {
      if (assigned.add(candidate.itemId())) {
        groups.add(new Group(candidate.topic(), new ArrayList<>(List.of(candidate))));
      }
    }

    Map<UUID, List<DigestCandidate>> duplicatesByCanonical =
        storageGateway.loadDuplicatesOf(byId.keySet()).stream()
            .collect(
                Collectors.groupingBy(
                    DigestCandidate::duplicateOfItemId, LinkedHashMap::new, Collectors.toList()));

    groups.forEach(g -> g.members().sort(MEMBER_ORDER));
    groups.sort(
        Comparator.comparingDouble(Group::maxImportance)
            .reversed()
            .thenComparing(g -> g.members().get(0), MEMBER_ORDER));

    List<PlannedEntry> plan = new ArrayList<>(groups.size());
    for (Group group : groups) {
      plan.add(toEntry(group, duplicatesByCanonical));
    }
    return plan;
  }

  private static PlannedEntry toEntry(
      Group group, Map<UUID, List<DigestCandidate>> duplicatesByCanonical) {
    List<DigestSource> sources = new ArrayList<>();
    List<UUID> itemIds = new ArrayList<>();
    StringBuilder body = new StringBuilder();
    for (DigestCandidate member : group.members()) {
      if (body.length() > 0) {
        body.append('\n');
      }
      body.append(BULLET).append(member.summary().trim());
      sources.add(new DigestSource(member.channel(), member.sourceMessageId()));
      itemIds.add(member.itemId());
    }
    for (DigestCandidate member : group.members()) {
      List<DigestCandidate> duplicates =
          duplicatesByCanonical.getOrDefault(member.itemId(), List.of());
      for (DigestCandidate duplicate : duplicates) {
        sources.add(new DigestSource(duplicate.channel(), duplicate.sourceMessageId()));
        itemIds.add(duplicate.itemId());
      }
    }
    String title =
        group.topic() == null || group.topic().isBlank()
            ? group.members().get(0).topic()
            : group.topic();
    return new PlannedEntry(new DigestEntryDraft(title, body.toString(), sources), itemIds);
  }

  record PlannedEntry(DigestEntryDraft entry, List<UUID> itemIds) {}

  private record Group(String topic, List<DigestCandidate> members) {
    double maxImportance() {
      return members.stream().mapToDouble(DigestCandidate::importanceScore).max().orElse(0.0);
    }
  }
}
