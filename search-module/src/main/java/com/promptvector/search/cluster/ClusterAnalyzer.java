package com.promptvector.search.cluster;

import com.promptvector.common.model.ClusterMember;
import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusterStats;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.EffectivenessStats;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.exception.UnsupportedClusteringAlgorithmException;
import com.promptvector.search.exception.ValidationException;
import com.promptvector.search.similarity.VectorSimilarity;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * K-means clustering of the stored vectors under cosine distance.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClusterAnalyzer {

    public static final int DEFAULT_CLUSTERS = 10;

    private static final int DOMINANT_TAGS = 5;

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final VectorSimilarity similarity;
    private final ResultCaches caches;
    private final Random random;

    public List<ClusterResult> clusterDocuments() {
        return clusterDocuments(DEFAULT_CLUSTERS, ClusteringAlgorithm.KMEANS);
    }

    /**
     * Разбить документы на k кластеров
     * @throws ValidationException if k is not in 1..N
     * @throws UnsupportedClusteringAlgorithmException for algorithms other than k-means
     */
    public List<ClusterResult> clusterDocuments(int k, ClusteringAlgorithm algorithm) {
        ClusteringAlgorithm effective = algorithm == null ? ClusteringAlgorithm.KMEANS : algorithm;
        if (effective != ClusteringAlgorithm.KMEANS) {
            throw new UnsupportedClusteringAlgorithmException(effective);
        }
        if (k < 1) {
            throw new ValidationException("Number of clusters must be positive, got " + k);
        }

        long generation = caches.generation();
        List<ClusterResult> cached = caches.cachedClusters(generation, k, effective).orElse(null);
        if (cached != null) {
            log.debug("Cluster cache hit for k={}", k);
            return cached;
        }

        List<VectorDocument> documents = documentStore.allDocuments();
        if (k > documents.size()) {
            throw new ValidationException(String.format(
                "Cannot create more clusters than documents: requested %d, available %d", k, documents.size()));
        }

        List<ClusterResult> clusters = kMeans(documents, k);
        caches.cacheClusters(generation, k, effective, clusters);
        log.info("Clustered {} documents into {} clusters", documents.size(), k);
        return clusters;
    }

    /**
     * Mean silhouette coefficient under cosine distance, in [-1, 1].
     * Singleton clusters contribute 0; fewer than two non-empty clusters give 0.
     */
    public double silhouetteScore(List<ClusterResult> clusters) {
        Map<String, float[]> vectors = new HashMap<>();
        for (VectorDocument document : documentStore.allDocuments()) {
            vectors.put(document.id(), document.vector());
        }
        List<List<float[]>> groups = new ArrayList<>();
        for (ClusterResult cluster : clusters) {
            List<float[]> members = cluster.members().stream()
                .map(member -> vectors.get(member.documentId()))
                .filter(vector -> vector != null)
                .toList();
            if (!members.isEmpty()) {
                groups.add(members);
            }
        }
        if (groups.size() < 2) {
            return 0.0;
        }

        double total = 0.0;
        int points = 0;
        for (int own = 0; own < groups.size(); own++) {
            List<float[]> group = groups.get(own);
            for (int i = 0; i < group.size(); i++) {
                points++;
                if (group.size() == 1) {
                    continue;
                }
                double a = 0.0;
                for (int j = 0; j < group.size(); j++) {
                    if (j != i) {
                        a += similarity.cosineDistance(group.get(i), group.get(j));
                    }
                }
                a /= group.size() - 1;

                double b = Double.POSITIVE_INFINITY;
                for (int other = 0; other < groups.size(); other++) {
                    if (other != own) {
                        b = Math.min(b, meanDistance(group.get(i), groups.get(other)));
                    }
                }
                double scale = Math.max(a, b);
                total += scale == 0.0 ? 0.0 : (b - a) / scale;
            }
        }
        return total / points;
    }

    private List<ClusterResult> kMeans(List<VectorDocument> documents, int k) {
        int n = documents.size();
        int dimension = properties.getDimension();

        List<Integer> indices = new ArrayList<>(IntStream.range(0, n).boxed().toList());
        Collections.shuffle(indices, random);
        float[][] centroids = new float[k][];
        for (int c = 0; c < k; c++) {
            centroids[c] = documents.get(indices.get(c)).vector().clone();
        }

        int[] assignments = new int[n];
        Arrays.fill(assignments, -1);
        int iterations = 0;
        boolean converged = false;
        while (!converged && iterations < properties.getCluster().getMaxIterations()) {
            converged = true;
            for (int i = 0; i < n; i++) {
                int nearest = nearestCentroid(documents.get(i).vector(), centroids);
                if (nearest != assignments[i]) {
                    assignments[i] = nearest;
                    converged = false;
                }
            }
            for (int c = 0; c < k; c++) {
                List<float[]> members = new ArrayList<>();
                for (int i = 0; i < n; i++) {
                    if (assignments[i] == c) {
                        members.add(documents.get(i).vector());
                    }
                }
                // пустой кластер сохраняет прежний центроид
                if (!members.isEmpty()) {
                    centroids[c] = similarity.centroid(members, dimension);
                }
            }
            iterations++;
        }
        log.debug("K-means finished after {} iterations, converged={}", iterations, converged);

        List<ClusterResult> clusters = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            List<VectorDocument> members = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (assignments[i] == c) {
                    members.add(documents.get(i));
                }
            }
            clusters.add(buildCluster(c, centroids[c], members));
        }
        return clusters;
    }

    private int nearestCentroid(float[] vector, float[][] centroids) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double distance = similarity.cosineDistance(vector, centroids[c]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    private ClusterResult buildCluster(int index, float[] centroid, List<VectorDocument> members) {
        List<ClusterMember> clusterMembers = members.stream()
            .map(doc -> new ClusterMember(doc.id(), similarity.cosineDistance(doc.vector(), centroid)))
            .toList();

        ClusterStats stats = ClusterStats.builder()
            .size(members.size())
            .averageSimilarity(averagePairwiseSimilarity(members))
            .dominantTags(dominantTags(members))
            .effectiveness(effectivenessStats(members))
            .build();

        return ClusterResult.builder()
            .id("cluster_" + index)
            .name("Cluster " + (index + 1))
            .centroid(centroid)
            .members(clusterMembers)
            .stats(stats)
            .build();
    }

    private double averagePairwiseSimilarity(List<VectorDocument> members) {
        double total = 0.0;
        int comparisons = 0;
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                total += similarity.cosineSimilarity(members.get(i).vector(), members.get(j).vector());
                comparisons++;
            }
        }
        return comparisons > 0 ? total / comparisons : 0.0;
    }

    /**
     * Up to five most frequent tags; ties keep first-seen order
     */
    private static List<String> dominantTags(List<VectorDocument> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (VectorDocument member : members) {
            for (String tag : member.metadata().tags()) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(DOMINANT_TAGS)
            .map(Map.Entry::getKey)
            .toList();
    }

    /**
     * Статистика по положительным значениям эффективности
     */
    static EffectivenessStats effectivenessStats(List<VectorDocument> members) {
        double[] values = members.stream()
            .map(member -> member.metadata().effectiveness())
            .filter(value -> value != null && value > 0)
            .mapToDouble(Double::doubleValue)
            .sorted()
            .toArray();
        if (values.length == 0) {
            return EffectivenessStats.EMPTY;
        }
        double mean = Arrays.stream(values).average().orElse(0.0);
        double median = values[values.length / 2];
        double variance = Arrays.stream(values).map(value -> (value - mean) * (value - mean)).sum() / values.length;
        return new EffectivenessStats(mean, median, Math.sqrt(variance));
    }

    private double meanDistance(float[] vector, List<float[]> group) {
        double total = 0.0;
        for (float[] other : group) {
            total += similarity.cosineDistance(vector, other);
        }
        return total / group.size();
    }
}
