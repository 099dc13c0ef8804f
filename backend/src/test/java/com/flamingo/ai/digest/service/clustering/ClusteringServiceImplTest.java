package com.flamingo.ai.digest.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.domain.model.TimeWindow;
import com.flamingo.ai.digest.storage.StorageGateway;
import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClusteringServiceImpl Tests")
class ClusteringServiceImplTest {

  private static final TimeWindow WINDOW =
      new TimeWindow(Instant.parse("2026-03-01T10:00:00Z"), Instant.parse("2026-03-01T11:00:00Z"));

  @Mock private StorageGateway storageGateway;

  private ClusteringServiceImpl service;

  @BeforeEach
  void setUp() {
    service =
        new ClusteringServiceImpl(
            storageGateway, new SimilarityGraphClusterer(), new PipelineConfig());
  }

  @Test
  @DisplayName("Should replace the window clusters with a fresh grouping")
  void shouldRebuildClusters() {
    ClusterCandidate a = candidate("Rates", 0.9, 1f, 0f);
    ClusterCandidate b = candidate("Rates 2", 0.6, 1f, 0.01f);
    ClusterCandidate c = candidate("Sport", 0.8, 0f, 1f);
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();
    when(storageGateway.loadClusterCandidates(WINDOW, 0.3, 500)).thenReturn(List.of(a, b, c));
    when(storageGateway.deleteClustersForWindow(WINDOW)).thenReturn(4);
    when(storageGateway.createCluster(WINDOW, "Rates")).thenReturn(first);
    when(storageGateway.createCluster(WINDOW, "Sport")).thenReturn(second);

    ClusteringResult result = service.rebuild(WINDOW);

    assertThat(result.items()).isEqualTo(3);
    assertThat(result.clusters()).isEqualTo(2);
    InOrder order = inOrder(storageGateway);
    order.verify(storageGateway).deleteClustersForWindow(WINDOW);
    order.verify(storageGateway).createCluster(WINDOW, "Rates");
    order.verify(storageGateway).addToCluster(first, a.itemId());
    order.verify(storageGateway).addToCluster(first, b.itemId());
    order.verify(storageGateway).createCluster(WINDOW, "Sport");
    order.verify(storageGateway).addToCluster(second, c.itemId());
  }

  @Test
  @DisplayName("Should clear stale clusters when the window is empty")
  void shouldClearEmptyWindow() {
    when(storageGateway.loadClusterCandidates(WINDOW, 0.3, 500)).thenReturn(List.of());

    ClusteringResult result = service.rebuild(WINDOW);

    assertThat(result.clusters()).isZero();
    verify(storageGateway).deleteClustersForWindow(WINDOW);
  }

  private static ClusterCandidate candidate(String topic, double importance, float... vector) {
    return new ClusterCandidate(
        UUID.randomUUID(), topic, importance, WINDOW.start().plusSeconds(30), vector);
  }
}
