package com.promptvector.search.service;

import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.DocumentListRequest;
import com.promptvector.common.model.DriftReport;
import com.promptvector.common.model.IndexStatistics;
import com.promptvector.common.model.Interaction;
import com.promptvector.common.model.OptimizationReport;
import com.promptvector.common.model.SearchQuery;
import com.promptvector.common.model.SearchResult;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.cluster.ClusterAnalyzer;
import com.promptvector.search.drift.DriftAnalyzer;
import com.promptvector.search.maintenance.IndexOptimizer;
import com.promptvector.search.maintenance.StatisticsCollector;
import com.promptvector.search.query.SearchEngine;
import com.promptvector.search.recommendation.RecommendationEngine;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class VectorDatabaseServiceImpl implements VectorDatabaseService {

    private final DocumentStore documentStore;
    private final SearchEngine searchEngine;
    private final ClusterAnalyzer clusterAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final DriftAnalyzer driftAnalyzer;
    private final StatisticsCollector statisticsCollector;
    private final IndexOptimizer indexOptimizer;

    @Override
    public VectorDocument addDocument(VectorDocument document) {
        return documentStore.addDocument(document);
    }

    @Override
    public List<VectorDocument> addDocuments(List<VectorDocument> documents) {
        return documentStore.addDocuments(documents);
    }

    @Override
    public VectorDocument updateDocument(VectorDocument document) {
        return documentStore.updateDocument(document);
    }

    @Override
    public void deleteDocument(String documentId) {
        documentStore.deleteDocument(documentId);
    }

    @Override
    public Optional<VectorDocument> getDocumentById(String documentId) {
        return documentStore.getDocumentById(documentId);
    }

    @Override
    public List<VectorDocument> listDocuments(DocumentListRequest request) {
        return documentStore.listDocuments(request);
    }

    @Override
    public List<SearchResult> search(SearchQuery query) {
        return searchEngine.search(query);
    }

    @Override
    public List<SearchResult> findSimilarDocuments(String documentId) {
        return searchEngine.findSimilarDocuments(documentId);
    }

    @Override
    public List<SearchResult> findSimilarDocuments(String documentId, double threshold, int limit) {
        return searchEngine.findSimilarDocuments(documentId, threshold, limit);
    }

    @Override
    public List<ClusterResult> clusterDocuments(int numClusters, ClusteringAlgorithm algorithm) {
        return clusterAnalyzer.clusterDocuments(numClusters, algorithm);
    }

    @Override
    public List<SearchResult> getRecommendations(String userId, List<Interaction> history, int limit) {
        return recommendationEngine.getRecommendations(userId, history, limit);
    }

    @Override
    public DriftReport analyzeSemanticDrift() {
        return driftAnalyzer.analyzeSemanticDrift();
    }

    @Override
    public IndexStatistics getStatistics() {
        return statisticsCollector.collect();
    }

    @Override
    public OptimizationReport optimize() {
        return indexOptimizer.optimize();
    }

    @Override
    public void clearDatabase() {
        log.info("Clearing vector database");
        documentStore.clear();
    }
}
