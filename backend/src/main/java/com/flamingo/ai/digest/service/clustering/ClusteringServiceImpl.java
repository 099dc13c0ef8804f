package com.flamingo.ai.digest.service.clustering;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of ClusteringService over the storage gateway. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClusteringServiceImpl implements ClusteringService {

  private final StorageGateway storageGateway;
  private final SimilarityGraphClusterer clusterer;
  private final PipelineConfig pipelineConfig;

  @Override
  @Transactional
  @Timed(value = "clustering.rebuild", description = "Time to rebuild the clusters of a window")
  public ClusteringResult rebuild(TimeWindow window) {
    PipelineConfig.Clustering config = pipelineConfig.getClustering();
    List<ClusterCandidate> candidates =
        storageGateway.loadClusterCandidates(
            window, pipelineConfig.getDigest().getImportanceThreshold(), config.getMaxItems());
    List<ClusterGroup> groups =
        clusterer.cluster(candidates, config.getSimilarity(), config.getMaxClusterSize());

    int removed = storageGateway.deleteClustersForWindow(window);
    for (ClusterGroup group : groups) {
      UUID clusterId = storageGateway.createCluster(window, group.topic());
      for (UUID itemId : group.itemIds()) {
        storageGateway.addToCluster(clusterId, itemId);
      }
    }
    log.info(
        "Clustered window {}: {} items into {} clusters (replaced {})",
        window,
        candidates.size(),
        groups.size(),
        removed);
    return new ClusteringResult(window, candidates.size(), groups.size());
  }
}
