package com.flamingo.ai.digest.service.clustering;

import java.util.List;
import java.util.UUID;

/** One cluster before it is persisted; members are in importance order. */
public record ClusterGroup(String topic, List<UUID> itemIds) {}
