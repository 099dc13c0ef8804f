package com.flamingo.ai.digest.service.clustering;

import com.flamingo.ai.digest.domain.model.TimeWindow;

/** Groups the ready items of a window into topic clusters. */
public interface ClusteringService {

  /**
   * Replaces the clusters of {@code window} with a fresh clustering of its ready, embedded items.
   * Readers see either the previous clusters or the new ones.
   */
  ClusteringResult rebuild(TimeWindow window);
}
