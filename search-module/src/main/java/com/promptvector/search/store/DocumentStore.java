package com.promptvector.search.store;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.promptvector.common.model.DocumentListRequest;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.analytics.AnalyticsPublisher;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.exception.DimensionMismatchException;
import com.promptvector.search.exception.DocumentNotFoundException;
import com.promptvector.search.exception.InternalVectorSearchException;
import com.promptvector.search.exception.ValidationException;
import com.promptvector.search.index.FlatVectorIndex;
import com.promptvector.search.index.ScoredCandidate;
import com.promptvector.search.index.VectorIndex;
import com.promptvector.search.metrics.PerformanceTracker;
import com.promptvector.search.quantization.VectorQuantizer;
import com.promptvector.search.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of the document map and of every structure derived from it: the flat index,
 * the hierarchical index and the quantized codes.
 * <p>
 * Mutations and index reads share one read-write lock, so a search never observes
 * a half-applied write or a compaction in progress.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentStore {

    private static final String ENTITY_TYPE = "vector_document";

    private final VectorSearchProperties properties;
    private final VectorSimilarity similarity;
    private final FlatVectorIndex flatIndex;
    private final VectorIndex vectorIndex;
    private final VectorQuantizer quantizer;
    private final ResultCaches caches;
    private final AnalyticsPublisher analytics;
    private final PerformanceTracker performance;
    @Qualifier("ingestExecutor")
    private final ExecutorService ingestExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** id → документ в порядке первой вставки */
    private final Map<String, VectorDocument> documents = new LinkedHashMap<>();

    /**
     * Добавить документ или заменить существующий с тем же id
     * @return сохранённый документ с нормализованным вектором
     */
    public VectorDocument addDocument(VectorDocument document) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        validate(document);
        VectorDocument prepared = normalized(document);

        lock.writeLock().lock();
        try {
            apply(prepared);
        } finally {
            lock.writeLock().unlock();
        }
        caches.invalidateAll();

        performance.record(PerformanceTracker.ADD_DOCUMENT, stopwatch.elapsed());
        analytics.publish("vector_document_added", prepared.id(), ENTITY_TYPE, describe(prepared));
        log.debug("Stored document {} in {}", prepared.id(), stopwatch);
        return prepared;
    }

    /**
     * Batch insert. The whole batch is validated before anything is stored; vectors are
     * normalized in parallel per chunk and applied in batch order, so for repeated ids the
     * last occurrence wins.
     * @return stored documents in batch order
     */
    public List<VectorDocument> addDocuments(List<VectorDocument> batch) {
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        batch.forEach(this::validate);

        List<VectorDocument> stored = new ArrayList<>(batch.size());
        List<List<VectorDocument>> chunks = Lists.partition(batch, properties.getBatch().getChunkSize());
        for (int i = 0; i < chunks.size(); i++) {
            Stopwatch chunkWatch = Stopwatch.createStarted();
            List<VectorDocument> prepared = prepareChunk(chunks.get(i));

            lock.writeLock().lock();
            try {
                prepared.forEach(this::apply);
            } finally {
                lock.writeLock().unlock();
            }
            caches.invalidateAll();
            stored.addAll(prepared);
            performance.record(PerformanceTracker.ADD_DOCUMENT, chunkWatch.elapsed().dividedBy(prepared.size()));

            if (i + 1 < chunks.size()) {
                pauseBetweenChunks();
            }
        }

        if (batch.size() > properties.getBatch().getRecalibrationThreshold()) {
            quantizer.recalibrate();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", batch.size());
        data.put("chunks", chunks.size());
        analytics.publish("vector_documents_batch_added", null, ENTITY_TYPE, data);
        log.info("Batch added {} documents in {} chunks in {}", batch.size(), chunks.size(), stopwatch);
        return stored;
    }

    /**
     * Replace an existing document
     * @throws DocumentNotFoundException if no document has this id
     */
    public VectorDocument updateDocument(VectorDocument document) {
        validate(document);
        VectorDocument prepared = normalized(document);

        lock.writeLock().lock();
        try {
            if (!documents.containsKey(prepared.id())) {
                throw new DocumentNotFoundException(prepared.id());
            }
            apply(prepared);
        } finally {
            lock.writeLock().unlock();
        }
        caches.invalidateAll();

        analytics.publish("vector_document_updated", prepared.id(), ENTITY_TYPE, describe(prepared));
        log.debug("Updated document {}", prepared.id());
        return prepared;
    }

    /**
     * Удалить документ из всех структур
     * @throws DocumentNotFoundException if no document has this id
     */
    public void deleteDocument(String documentId) {
        VectorDocument removed;
        lock.writeLock().lock();
        try {
            removed = documents.get(documentId);
            if (removed == null) {
                throw new DocumentNotFoundException(documentId);
            }
            // Порядок важен: иерархический индекс ищет слот через плоский
            vectorIndex.remove(documentId);
            flatIndex.remove(documentId);
            quantizer.remove(documentId);
            documents.remove(documentId);
        } finally {
            lock.writeLock().unlock();
        }
        caches.invalidateAll();

        analytics.publish("vector_document_deleted", documentId, ENTITY_TYPE, describe(removed));
        log.debug("Deleted document {}", documentId);
    }

    public Optional<VectorDocument> getDocumentById(String documentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documents.get(documentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Documents in insertion order matching the optional domain and type, paginated.
     */
    public List<VectorDocument> listDocuments(DocumentListRequest request) {
        DocumentListRequest effective = request == null ? DocumentListRequest.all() : request;
        lock.readLock().lock();
        try {
            return documents.values().stream()
                .filter(doc -> effective.domain() == null || effective.domain().equals(doc.metadata().domain()))
                .filter(doc -> effective.type() == null || effective.type() == doc.metadata().type())
                .skip(effective.offset())
                .limit(effective.limit())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of every stored document in insertion order
     */
    public List<VectorDocument> allDocuments() {
        lock.readLock().lock();
        try {
            return List.copyOf(documents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Nearest stored documents to an already normalized vector, by descending similarity.
     * Uses the hierarchical index, which falls back to a linear scan while it is empty.
     */
    public List<DocumentMatch> nearest(float[] normalizedVector, int k, double threshold) {
        lock.readLock().lock();
        try {
            List<ScoredCandidate> candidates = vectorIndex.search(normalizedVector, k, threshold);
            List<DocumentMatch> matches = new ArrayList<>(candidates.size());
            for (ScoredCandidate candidate : candidates) {
                VectorDocument document = documents.get(candidate.id());
                if (document != null) {
                    matches.add(new DocumentMatch(document, candidate.similarity()));
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reclaims tombstoned slots and rebuilds the hierarchical index over the compacted slots.
     * @return number of reclaimed slots
     */
    public int compactAndRebuild() {
        lock.writeLock().lock();
        try {
            int reclaimed = flatIndex.compact();
            vectorIndex.rebuild();
            log.info("Rebuilt hierarchical index over {} documents, reclaimed {} slots", documents.size(), reclaimed);
            return reclaimed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops quantized codes and adjacency references that point at deleted documents.
     * @return number of removed entries
     */
    public int collectGarbage() {
        lock.writeLock().lock();
        try {
            int codes = quantizer.retainOnly(documents.keySet());
            int references = vectorIndex.collectGarbage();
            log.info("Garbage collection removed {} quantized codes and {} adjacency references", codes, references);
            return codes + references;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Удалить все документы и индексы
     */
    public void clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = documents.size();
            vectorIndex.clear();
            flatIndex.clear();
            quantizer.clear();
            documents.clear();
        } finally {
            lock.writeLock().unlock();
        }
        caches.invalidateAll();

        analytics.publish("vector_database_cleared", null, "vector_database", Map.of("removed", removed));
        log.info("Cleared vector database, {} documents removed", removed);
    }

    private void apply(VectorDocument document) {
        documents.put(document.id(), document);
        flatIndex.put(document.id(), document.vector());
        vectorIndex.insert(document.id());
        quantizer.encode(document.id(), document.vector());
    }

    private List<VectorDocument> prepareChunk(List<VectorDocument> chunk) {
        List<CompletableFuture<VectorDocument>> futures = chunk.stream()
            .map(document -> CompletableFuture.supplyAsync(() -> normalized(document), ingestExecutor))
            .toList();
        List<VectorDocument> prepared = new ArrayList<>(chunk.size());
        for (CompletableFuture<VectorDocument> future : futures) {
            try {
                prepared.add(future.join());
            } catch (CompletionException e) {
                throw new InternalVectorSearchException("Failed to prepare document batch", e.getCause());
            }
        }
        return prepared;
    }

    private void pauseBetweenChunks() {
        try {
            Thread.sleep(properties.getBatch().getPause().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalVectorSearchException("Batch insert interrupted", e);
        }
    }

    private void validate(VectorDocument document) {
        if (document == null) {
            throw new ValidationException("Document cannot be null");
        }
        if (document.dimension() != properties.getDimension()) {
            throw new DimensionMismatchException(properties.getDimension(), document.dimension());
        }
        for (float value : document.vector()) {
            if (!Float.isFinite(value)) {
                throw new ValidationException("Vector of document " + document.id() + " contains non-finite values");
            }
        }
    }

    private VectorDocument normalized(VectorDocument document) {
        return document.withVector(similarity.normalize(document.vector()));
    }

    private Map<String, Object> describe(VectorDocument document) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (document.metadata().domain() != null) {
            data.put("domain", document.metadata().domain());
        }
        data.put("type", document.metadata().type().jsonValue());
        data.put("vectorDimension", document.dimension());
        data.put("tags", List.copyOf(document.metadata().tags()));
        return data;
    }
}
