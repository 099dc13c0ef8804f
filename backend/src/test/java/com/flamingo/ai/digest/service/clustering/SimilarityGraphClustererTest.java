package com.flamingo.ai.digest.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SimilarityGraphClusterer Tests")
class SimilarityGraphClustererTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final SimilarityGraphClusterer clusterer = new SimilarityGraphClusterer();

  @Test
  @DisplayName("Should group similar items and leave unrelated ones alone")
  void shouldGroupSimilarItems() {
    ClusterCandidate rates1 = candidate("Rates", 0.9, 0, 1f, 0f, 0f);
    ClusterCandidate rates2 = candidate("Rates again", 0.5, 1, 0.95f, 0.05f, 0f);
    ClusterCandidate sport = candidate("Sport", 0.7, 2, 0f, 0f, 1f);

    List<ClusterGroup> groups = clusterer.cluster(List.of(sport, rates2, rates1), 0.8, 10);

    assertThat(groups).hasSize(2);
    assertThat(groups.get(0).topic()).isEqualTo("Rates");
    assertThat(groups.get(0).itemIds()).containsExactly(rates1.itemId(), rates2.itemId());
    assertThat(groups.get(1).itemIds()).containsExactly(sport.itemId());
  }

  @Test
  @DisplayName("Should join items connected through a chain of similar neighbours")
  void shouldFollowChains() {
    // a~b and b~c, but a and c alone are below the threshold
    ClusterCandidate a = candidate("A", 0.9, 0, 1f, 0f);
    ClusterCandidate b = candidate("B", 0.8, 1, 0.8f, 0.6f);
    ClusterCandidate c = candidate("C", 0.7, 2, 0.28f, 0.96f);

    List<ClusterGroup> groups = clusterer.cluster(List.of(a, b, c), 0.79, 10);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).itemIds()).containsExactly(a.itemId(), b.itemId(), c.itemId());
  }

  @Test
  @DisplayName("Should produce the same clusters for any input order")
  void shouldBeOrderIndependent() {
    List<ClusterCandidate> candidates = new ArrayList<>();
    Random random = new Random(7);
    for (int i = 0; i < 20; i++) {
      float[] base = new float[3];
      base[i % 3] = 1f;
      base[(i + 1) % 3] = random.nextFloat() * 0.1f;
      candidates.add(candidate("T" + i, random.nextDouble(), i, base));
    }
    Set<Set<UUID>> expected = membership(clusterer.cluster(candidates, 0.9, 50));

    for (int round = 0; round < 5; round++) {
      List<ClusterCandidate> shuffled = new ArrayList<>(candidates);
      Collections.shuffle(shuffled, new Random(round));
      assertThat(membership(clusterer.cluster(shuffled, 0.9, 50))).isEqualTo(expected);
    }
    assertThat(expected).hasSize(3);
  }

  @Test
  @DisplayName("Should split components larger than the maximum cluster size")
  void shouldSplitLargeComponents() {
    List<ClusterCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      candidates.add(candidate("Same", 0.9 - i * 0.1, i, 1f, 0f));
    }

    List<ClusterGroup> groups = clusterer.cluster(candidates, 0.9, 2);

    assertThat(groups).extracting(g -> g.itemIds().size()).containsExactly(2, 2, 1);
    assertThat(groups.get(0).itemIds())
        .containsExactly(candidates.get(0).itemId(), candidates.get(1).itemId());
  }

  @Test
  @DisplayName("Should only merge identical directions at threshold 1.0")
  void shouldMergeOnlyIdenticalAtFullThreshold() {
    ClusterCandidate a = candidate("A", 0.9, 0, 1f, 0f);
    ClusterCandidate same = candidate("A2", 0.8, 1, 2f, 0f);
    ClusterCandidate close = candidate("B", 0.7, 2, 1f, 0.01f);

    List<ClusterGroup> groups = clusterer.cluster(List.of(a, same, close), 1.0, 10);

    assertThat(membership(groups))
        .containsExactlyInAnyOrder(Set.of(a.itemId(), same.itemId()), Set.of(close.itemId()));
  }

  @Test
  @DisplayName("Should return nothing for no candidates")
  void shouldHandleEmptyInput() {
    assertThat(clusterer.cluster(List.of(), 0.8, 10)).isEmpty();
  }

  private static Set<Set<UUID>> membership(List<ClusterGroup> groups) {
    return groups.stream().map(g -> Set.copyOf(g.itemIds())).collect(Collectors.toSet());
  }

  private static ClusterCandidate candidate(
      String topic, double importance, int minute, float... vector) {
    return new ClusterCandidate(
        UUID.randomUUID(), topic, importance, T0.plusSeconds(60L * minute), vector);
  }
}
