package com.promptvector.search.maintenance;

import com.promptvector.common.model.IndexStatistics;
import com.promptvector.common.model.OptimizationReport;
import com.promptvector.common.model.OptimizationStep;
import com.promptvector.common.model.PerformanceMetrics;
import com.promptvector.common.model.SearchQuery;
import com.promptvector.search.EngineFixture;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.quantization.VectorQuantizer;
import com.promptvector.search.store.DocumentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.promptvector.search.EngineFixture.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IndexOptimizerTest {

    private static IndexStatistics statistics(double avgSearchMs) {
        return IndexStatistics.builder()
            .performance(new PerformanceMetrics(avgSearchMs, 0.0, 0.0, 0.0))
            .build();
    }

    @Test
    void shouldComputeImprovementAsLatencyReduction() {
        assertThat(IndexOptimizer.improvement(10.0, 5.0)).isCloseTo(50.0, within(1e-9));
        assertThat(IndexOptimizer.improvement(4.0, 5.0)).isCloseTo(-25.0, within(1e-9));
        assertThat(IndexOptimizer.improvement(0.0, 5.0)).isZero();
    }

    @Nested
    class OnLiveEngine {

        @Test
        @DisplayName("После удаления связующего документа оптимизация восстанавливает достижимость")
        void shouldReconnectGraphSplitByDeletion() {
            try (EngineFixture fixture = new EngineFixture(properties -> properties.getIndex().setM(1))) {
                // with one link per node the hub is the only path between the two topics
                fixture.store.addDocument(document("hub", 1, 1, 0));
                for (int i = 0; i < 10; i++) {
                    fixture.store.addDocument(document("x" + i, 1, i * 0.01f, 0));
                }
                for (int i = 0; i < 10; i++) {
                    fixture.store.addDocument(document("y" + i, i * 0.01f, 1, 0));
                }
                assertThat(fixture.vectorIndex.neighbors("hub", 0)).contains("x0", "y0");
                fixture.store.deleteDocument("hub");

                assertThat(fixture.optimizer.optimize().fullySucceeded()).isTrue();

                assertThat(topic(fixture, new float[]{1, 0, 0}))
                    .containsExactlyInAnyOrderElementsOf(ids("x"));
                assertThat(topic(fixture, new float[]{0, 1, 0}))
                    .containsExactlyInAnyOrderElementsOf(ids("y"));
                for (String id : ids("x", "y")) {
                    float[] vector = fixture.store.getDocumentById(id).orElseThrow().vector();
                    assertThat(fixture.service.search(SearchQuery.forVector(vector, 0.9999, 3)))
                        .extracting(result -> result.document().id())
                        .contains(id);
                }
            }
        }

        private List<String> topic(EngineFixture fixture, float[] axis) {
            return fixture.service.search(SearchQuery.forVector(axis, 0.9, 50)).stream()
                .map(result -> result.document().id())
                .toList();
        }

        private List<String> ids(String... prefixes) {
            List<String> ids = new ArrayList<>();
            for (String prefix : prefixes) {
                for (int i = 0; i < 10; i++) {
                    ids.add(prefix + i);
                }
            }
            return ids;
        }

        @Test
        @DisplayName("Оптимизация освобождает слоты удалённых документов")
        void shouldReclaimDeletedDocuments() {
            try (EngineFixture fixture = new EngineFixture()) {
                fixture.store.addDocument(document("a", 1, 0, 0));
                fixture.store.addDocument(document("b", 0, 1, 0));
                fixture.store.addDocument(document("c", 0, 0, 1));
                fixture.store.addDocument(document("d", 1, 1, 0));
                fixture.store.addDocument(document("e", 0, 1, 1));
                fixture.store.deleteDocument("b");
                fixture.store.deleteDocument("d");
                assertThat(fixture.flatIndex.capacity()).isEqualTo(5);

                OptimizationReport report = fixture.optimizer.optimize();

                assertThat(report.fullySucceeded()).isTrue();
                assertThat(report.steps()).extracting(OptimizationStep::name).containsExactly(
                    IndexOptimizer.REBUILD_INDEX,
                    IndexOptimizer.RECALIBRATE_QUANTIZER,
                    IndexOptimizer.CLEAR_CACHES,
                    IndexOptimizer.GARBAGE_COLLECTION);
                assertThat(report.optimizationsApplied()).hasSize(4);
                assertThat(report.before().totalDocuments()).isEqualTo(3);
                assertThat(report.after().totalDocuments()).isEqualTo(3);
                assertThat(fixture.flatIndex.capacity()).isEqualTo(3);
                assertThat(fixture.quantizer.size()).isEqualTo(3);
                for (String id : List.of("a", "c", "e")) {
                    assertThat(fixture.vectorIndex.neighbors(id, 0)).isSubsetOf("a", "c", "e");
                }
                assertThat(fixture.service.search(SearchQuery.forVector(new float[]{0, 0, 1}, 0.9, 5)))
                    .extracting(result -> result.document().id())
                    .containsExactly("c");
            }
        }

        @Test
        void shouldRebalanceLargeCorpus() {
            try (EngineFixture fixture = new EngineFixture()) {
                fixture.properties.getMaintenance().setRebalanceThreshold(2);
                fixture.store.addDocument(document("a", 1, 0, 0));
                fixture.store.addDocument(document("b", 0, 1, 0));
                fixture.store.addDocument(document("c", 0, 0, 1));

                OptimizationReport report = fixture.optimizer.optimize();

                assertThat(report.steps()).extracting(OptimizationStep::name).endsWith(IndexOptimizer.REBALANCE);
                assertThat(report.fullySucceeded()).isTrue();
            }
        }

        @Test
        void shouldOptimizeEmptyCorpus() {
            try (EngineFixture fixture = new EngineFixture()) {
                OptimizationReport report = fixture.optimizer.optimize();

                assertThat(report.fullySucceeded()).isTrue();
                assertThat(report.performanceImprovement()).isZero();
            }
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithFailingStep {

        @Mock
        private DocumentStore documentStore;

        @Mock
        private VectorQuantizer quantizer;

        @Mock
        private ResultCaches caches;

        @Mock
        private StatisticsCollector statisticsCollector;

        @Test
        @DisplayName("Сбой одного шага не мешает остальным")
        void shouldContinueAfterFailedStep() {
            IndexOptimizer optimizer = new IndexOptimizer(
                new VectorSearchProperties(), documentStore, quantizer, caches, statisticsCollector);
            when(statisticsCollector.collect()).thenReturn(statistics(10.0), statistics(5.0));
            when(documentStore.compactAndRebuild()).thenThrow(new IllegalStateException("index is busy"));
            when(quantizer.recalibrate()).thenReturn(Optional.empty());

            OptimizationReport report = optimizer.optimize();

            assertThat(report.fullySucceeded()).isFalse();
            assertThat(report.steps()).hasSize(4);
            OptimizationStep rebuild = report.steps().get(0);
            assertThat(rebuild.name()).isEqualTo(IndexOptimizer.REBUILD_INDEX);
            assertThat(rebuild.succeeded()).isFalse();
            assertThat(rebuild.message()).isEqualTo("index is busy");
            assertThat(report.steps().subList(1, 4)).allMatch(OptimizationStep::succeeded);
            assertThat(report.performanceImprovement()).isCloseTo(50.0, within(1e-9));
            verify(caches).clearSearch();
            verify(caches).clearClusters();
            verify(documentStore).collectGarbage();
        }
    }
}
