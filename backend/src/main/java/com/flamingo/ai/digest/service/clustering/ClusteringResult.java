package com.flamingo.ai.digest.service.clustering;

import com.flamingo.ai.digest.domain.model.TimeWindow;

/** Summary of one window rebuild. */
public record ClusteringResult(TimeWindow window, int items, int clusters) {}
