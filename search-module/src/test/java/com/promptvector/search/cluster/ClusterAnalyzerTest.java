package com.promptvector.search.cluster;

import com.promptvector.common.model.ClusterMember;
import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.DocumentMetadata;
import com.promptvector.common.model.DocumentType;
import com.promptvector.common.model.EffectivenessStats;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.EngineFixture;
import com.promptvector.search.exception.UnsupportedClusteringAlgorithmException;
import com.promptvector.search.exception.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.promptvector.search.EngineFixture.NOW;
import static com.promptvector.search.EngineFixture.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ClusterAnalyzerTest {

    private EngineFixture fixture;
    private ClusterAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        analyzer = fixture.clusterAnalyzer;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static VectorDocument tagged(String id, Double effectiveness, Set<String> tags, float... vector) {
        DocumentMetadata metadata = DocumentMetadata.builder()
            .type(DocumentType.PROMPT)
            .created(NOW)
            .effectiveness(effectiveness)
            .tags(tags)
            .build();
        return document(id, metadata, vector);
    }

    private void addThree() {
        fixture.store.addDocument(document("a", 1, 0, 0));
        fixture.store.addDocument(document("b", 0, 1, 0));
        fixture.store.addDocument(document("c", 0, 0, 1));
    }

    @Test
    void shouldRejectMoreClustersThanDocuments() {
        addThree();

        assertThatThrownBy(() -> analyzer.clusterDocuments(5, ClusteringAlgorithm.KMEANS))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Cannot create more clusters than documents: requested 5, available 3");
    }

    @Test
    void shouldRejectNonPositiveClusterCount() {
        addThree();

        assertThatThrownBy(() -> analyzer.clusterDocuments(0, ClusteringAlgorithm.KMEANS))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectUnimplementedAlgorithms() {
        addThree();

        assertThatThrownBy(() -> analyzer.clusterDocuments(2, ClusteringAlgorithm.HIERARCHICAL))
            .isInstanceOf(UnsupportedClusteringAlgorithmException.class)
            .hasMessageContaining("hierarchical");
        assertThatThrownBy(() -> analyzer.clusterDocuments(2, ClusteringAlgorithm.DBSCAN))
            .isInstanceOf(UnsupportedClusteringAlgorithmException.class);
    }

    @Test
    void shouldPlaceEachDocumentInItsOwnClusterWhenKEqualsN() {
        addThree();

        List<ClusterResult> clusters = analyzer.clusterDocuments(3, ClusteringAlgorithm.KMEANS);

        assertThat(clusters).extracting(ClusterResult::id).containsExactly("cluster_0", "cluster_1", "cluster_2");
        assertThat(clusters).extracting(ClusterResult::name).containsExactly("Cluster 1", "Cluster 2", "Cluster 3");
        assertThat(clusters).allSatisfy(cluster -> {
            assertThat(cluster.size()).isEqualTo(1);
            assertThat(cluster.stats().averageSimilarity()).isZero();
            assertThat(cluster.members().get(0).distanceToCentroid()).isCloseTo(0.0, within(1e-6));
        });
        assertThat(clusters).flatExtracting(ClusterResult::members)
            .extracting(ClusterMember::documentId)
            .containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void shouldComputeStatsOfSingleCluster() {
        fixture.store.addDocument(tagged("a", 0.2, Set.of("java", "spring"), 1, 0, 0));
        fixture.store.addDocument(tagged("b", 0.8, Set.of("java"), 1, 0, 0));
        fixture.store.addDocument(tagged("c", null, Set.of("java", "spring"), 1, 0, 0));
        fixture.store.addDocument(tagged("d", 0.0, Set.of("python"), 1, 0, 0));

        ClusterResult cluster = analyzer.clusterDocuments(1, ClusteringAlgorithm.KMEANS).get(0);

        assertThat(cluster.size()).isEqualTo(4);
        assertThat(cluster.stats().size()).isEqualTo(4);
        assertThat(cluster.stats().averageSimilarity()).isCloseTo(1.0, within(1e-6));
        assertThat(cluster.stats().dominantTags()).containsExactly("java", "spring", "python");
        EffectivenessStats effectiveness = cluster.stats().effectiveness();
        assertThat(effectiveness.mean()).isCloseTo(0.5, within(1e-9));
        assertThat(effectiveness.median()).isCloseTo(0.8, within(1e-9));
        assertThat(effectiveness.standardDeviation()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void shouldAssignEveryDocumentExactlyOnce() {
        for (int i = 0; i < 12; i++) {
            fixture.store.addDocument(document("doc-" + i, (float) Math.cos(i), (float) Math.sin(i), i % 3));
        }

        List<ClusterResult> clusters = analyzer.clusterDocuments(4, null);

        assertThat(clusters).hasSize(4);
        assertThat(clusters).flatExtracting(ClusterResult::members)
            .extracting(ClusterMember::documentId)
            .hasSize(12)
            .doesNotHaveDuplicates();
        assertThat(clusters).allSatisfy(cluster -> assertThat(cluster.centroid()).hasSize(3));
    }

    @Test
    void shouldCacheUntilNextWrite() {
        addThree();

        List<ClusterResult> first = analyzer.clusterDocuments(2, ClusteringAlgorithm.KMEANS);
        List<ClusterResult> cached = analyzer.clusterDocuments(2, ClusteringAlgorithm.KMEANS);
        assertThat(cached).isEqualTo(first);
        assertThat(analyzer.clusterDocuments(2, ClusteringAlgorithm.KMEANS)).isSameAs(cached);

        fixture.store.deleteDocument("a");

        List<ClusterResult> after = analyzer.clusterDocuments(2, ClusteringAlgorithm.KMEANS);
        assertThat(after).flatExtracting(ClusterResult::members)
            .extracting(ClusterMember::documentId)
            .containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void shouldScoreWellSeparatedClustersHighly() {
        fixture.store.addDocument(document("a1", 1, 0, 0));
        fixture.store.addDocument(document("a2", 0.95f, 0.05f, 0));
        fixture.store.addDocument(document("b1", 0, 0, 1));
        fixture.store.addDocument(document("b2", 0, 0.05f, 0.95f));
        List<ClusterResult> clusters = List.of(
            ClusterResult.builder().id("cluster_0").members(List.of(
                new ClusterMember("a1", 0.0), new ClusterMember("a2", 0.0))).build(),
            ClusterResult.builder().id("cluster_1").members(List.of(
                new ClusterMember("b1", 0.0), new ClusterMember("b2", 0.0))).build());

        assertThat(analyzer.silhouetteScore(clusters)).isGreaterThan(0.9);
    }

    @Test
    void shouldScoreSingletonsAsZero() {
        addThree();

        assertThat(analyzer.silhouetteScore(analyzer.clusterDocuments(3, ClusteringAlgorithm.KMEANS))).isZero();
        assertThat(analyzer.silhouetteScore(List.of())).isZero();
    }
}
