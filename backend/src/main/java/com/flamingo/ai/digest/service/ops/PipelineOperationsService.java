package com.flamingo.ai.digest.service.ops;

import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.service.clustering.ClusteringResult;
import com.flamingo.ai.digest.service.digest.DigestRunResult;
import com.flamingo.ai.digest.storage.model.ItemErrorView;
import com.flamingo.ai.digest.storage.model.PipelineStats;
import java.util.List;
import java.util.UUID;

/** Operator actions on the pipeline. */
public interface PipelineOperationsService {

  List<ItemErrorView> recentErrors(int limit);

  /**
   * Requeues one failed item with a fresh retry budget.
   *
   * @throws com.flamingo.ai.digest.exception.ItemNotFoundException if the item does not exist
   * @throws com.flamingo.ai.digest.exception.ItemNotRetryableException if the item has not failed
   */
  void retryItem(UUID itemId);

  /** Requeues every failed item; returns how many were requeued. */
  int retryFailedItems();

  /** Deletes failed digest rows so their windows can be assembled again. */
  int clearDigestErrors();

  PipelineStats stats();

  /**
   * Sets the weight applied to the importance of a channel's newly enriched items.
   *
   * @throws com.flamingo.ai.digest.exception.ChannelNotFoundException if the channel is unknown
   */
  void updateChannelWeight(String username, double weight);

  ClusteringResult rebuildClusters(TimeWindow window);

  /** Assembles the digest of a window; its clusters are rebuilt unless it is already posted. */
  DigestRunResult publishDigest(TimeWindow window, String chatId);
}
