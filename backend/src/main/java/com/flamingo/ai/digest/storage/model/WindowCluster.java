package com.flamingo.ai.digest.storage.model;

import java.util.List;
import java.util.UUID;

/** A persisted cluster of a window with its member item ids. */
public record WindowCluster(UUID clusterId, String topic, List<UUID> itemIds) {}
