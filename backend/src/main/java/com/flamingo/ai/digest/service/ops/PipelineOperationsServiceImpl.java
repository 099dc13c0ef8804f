package com.flamingo.ai.digest.service.ops;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.exception.ChannelNotFoundException;
import com.flamingo.ai.digest.service.clustering.ClusteringResult;
import com.flamingo.ai.digest.service.clustering.ClusteringService;
import com.flamingo.ai.digest.service.digest.DigestAssembler;
import com.flamingo.ai.digest.service.digest.DigestRunResult;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.ItemErrorView;
import com.flamingo.ai.digest.storage.model.PipelineStats;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of PipelineOperationsService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOperationsServiceImpl implements PipelineOperationsService {

  private static final int MAX_ERROR_PAGE = 200;

  private final StorageGateway storageGateway;
  private final ClusteringService clusteringService;
  private final DigestAssembler digestAssembler;
  private final PipelineConfig pipelineConfig;

  @Override
  public List<ItemErrorView> recentErrors(int limit) {
    return storageGateway.findRecentErrors(Math.max(1, Math.min(limit, MAX_ERROR_PAGE)));
  }

  @Override
  public void retryItem(UUID itemId) {
    storageGateway.retryItem(itemId);
    log.info("Item {} requeued by operator", itemId);
  }

  @Override
  public int retryFailedItems() {
    int count = storageGateway.retryFailedItems();
    log.info("{} failed items requeued by operator", count);
    return count;
  }

  @Override
  public int clearDigestErrors() {
    int count = storageGateway.clearDigestErrors();
    log.info("{} digest errors cleared by operator", count);
    return count;
  }

  @Override
  @Timed(value = "ops.stats", description = "Time to compute pipeline statistics")
  public PipelineStats stats() {
    return storageGateway.loadStats();
  }

  @Override
  public void updateChannelWeight(String username, double weight) {
    if (!storageGateway.updateChannelImportanceWeight(username, weight)) {
      throw new ChannelNotFoundException(username);
    }
    log.info("Importance weight of channel {} set to {} by operator", username, weight);
  }

  @Override
  public ClusteringResult rebuildClusters(TimeWindow window) {
    return clusteringService.rebuild(window);
  }

  @Override
  public DigestRunResult publishDigest(TimeWindow window, String chatId) {
    String target =
        chatId == null || chatId.isBlank() ? pipelineConfig.getDigest().getChatId() : chatId;
    return digestAssembler.assemble(window, target);
  }
}
