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

import java.util.List;
import java.util.Optional;

/** Интерфейс векторной базы промптов */
public interface VectorDatabaseService {

    /** Добавить или заменить документ */
    VectorDocument addDocument(VectorDocument document);

    /** Добавить батч документов */
    List<VectorDocument> addDocuments(List<VectorDocument> documents);

    /** Обновить существующий документ */
    VectorDocument updateDocument(VectorDocument document);

    /** Удалить документ по ID */
    void deleteDocument(String documentId);

    /** Получить документ по ID */
    Optional<VectorDocument> getDocumentById(String documentId);

    /** Список документов с фильтрами и пагинацией */
    List<VectorDocument> listDocuments(DocumentListRequest request);

    /** Поиск похожих документов по вектору или тексту */
    List<SearchResult> search(SearchQuery query);

    /** Документы, похожие на данный (порог 0.7, до 10 результатов) */
    List<SearchResult> findSimilarDocuments(String documentId);

    /** Документы, похожие на данный */
    List<SearchResult> findSimilarDocuments(String documentId, double threshold, int limit);

    /** Кластеризация документов */
    List<ClusterResult> clusterDocuments(int numClusters, ClusteringAlgorithm algorithm);

    /** Рекомендации по истории взаимодействий */
    List<SearchResult> getRecommendations(String userId, List<Interaction> history, int limit);

    /** Анализ семантического дрейфа */
    DriftReport analyzeSemanticDrift();

    /** Статистика базы */
    IndexStatistics getStatistics();

    /** Обслуживание индексов */
    OptimizationReport optimize();

    /** Удалить все документы */
    void clearDatabase();
}
