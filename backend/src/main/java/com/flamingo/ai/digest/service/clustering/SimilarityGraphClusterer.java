package com.flamingo.ai.digest.service.clustering;

import com.flamingo.ai.digest.service.similarity.SimilarityIndex;
import com.flamingo.ai.digest.storage.model.ClusterCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Single-link clustering: items belong together iff a chain of pairwise cosine similarities at or
 * above the threshold connects them, i.e. connected components of the similarity graph.
 *
 * <p>Membership does not depend on input order. Candidates are first sorted by importance
 * (descending), first-seen time and id, which fixes cluster order and labels: a cluster is labelled
 * with the topic of its first member. Components larger than {@code maxClusterSize} are split into
 * consecutive chunks of that order.
 */
@Component
public class SimilarityGraphClusterer {

  static final Comparator<ClusterCandidate> IMPORTANCE_ORDER =
      Comparator.comparingDouble(ClusterCandidate::importanceScore)
          .reversed()
          .thenComparing(ClusterCandidate::firstSeenAt)
          .thenComparing(ClusterCandidate::itemId);

  public List<ClusterGroup> cluster(
      List<ClusterCandidate> candidates, double threshold, int maxClusterSize) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    List<ClusterCandidate> ordered = new ArrayList<>(candidates);
    ordered.sort(IMPORTANCE_ORDER);

    int n = ordered.size();
    UnionFind uf = new UnionFind(n);
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        double similarity =
            SimilarityIndex.cosine(ordered.get(i).vector(), ordered.get(j).vector());
        if (similarity >= threshold) {
          uf.union(i, j);
        }
      }
    }

    // Insertion order follows the first (most important) member of each component
    Map<Integer, List<ClusterCandidate>> components = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      components.computeIfAbsent(uf.find(i), k -> new ArrayList<>()).add(ordered.get(i));
    }

    int chunkSize = maxClusterSize > 0 ? maxClusterSize : n;
    List<ClusterGroup> groups = new ArrayList<>();
    for (List<ClusterCandidate> component : components.values()) {
      for (int from = 0; from < component.size(); from += chunkSize) {
        List<ClusterCandidate> chunk =
            component.subList(from, Math.min(from + chunkSize, component.size()));
        List<UUID> ids = chunk.stream().map(ClusterCandidate::itemId).toList();
        groups.add(new ClusterGroup(chunk.get(0).topic(), ids));
      }
    }
    return groups;
  }

  /** Union-Find (Disjoint Set Union) over candidate indexes. */
  private static class UnionFind {
    private final int[] parent;
    private final int[] rank;

    UnionFind(int size) {
      parent = new int[size];
      rank = new int[size];
      for (int i = 0; i < size; i++) {
        parent[i] = i;
      }
    }

    int find(int x) {
      if (parent[x] != x) {
        parent[x] = find(parent[x]);
      }
      return parent[x];
    }

    void union(int x, int y) {
      int rootX = find(x);
      int rootY = find(y);
      if (rootX == rootY) {
        return;
      }
      if (rank[rootX] < rank[rootY]) {
        parent[rootX] = rootY;
      } else if (rank[rootX] > rank[rootY]) {
        parent[rootY] = rootX;
      } else {
        parent[rootY] = rootX;
        rank[rootX]++;
      }
    }
  }
}
