package com.promptvector.search.index;

import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Simplified HNSW-style multi-level index over the slots of {@link FlatVectorIndex}.
 * <p>
 * A node assigned level L is present on levels 0..L. Its neighbours on each level are
 * chosen by an exhaustive scan of the nodes already on that level (true HNSW would use a
 * greedy per-level search here), and every neighbour gets a back-link. On upper levels
 * back-links are pruned to the M most similar links; on level 0 they are kept, so level-0
 * adjacency is symmetric and every live node stays reachable from the entry point until
 * deletions cut the graph. The entry point is always a node of the highest level.
 */
@Component
@Slf4j
public class HierarchicalVectorIndex implements VectorIndex {

    private static final double LEVEL_PROBABILITY = 0.5;

    private static final Comparator<Scored> BY_SIMILARITY_DESC = Comparator
        .comparingDouble(Scored::similarity).reversed()
        .thenComparingInt(Scored::slot);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final FlatVectorIndex flatIndex;
    private final VectorSimilarity vectorSimilarity;
    private final Random random;

    // Параметры индекса
    private final int m;
    private final int maxLevel;
    private final int efSearch;

    /** level → (slot → исходящие соседи) */
    private final List<Map<Integer, int[]>> levels = new ArrayList<>();

    /** slot → верхний уровень узла */
    private final Map<Integer, Integer> nodeLevels = new HashMap<>();

    private int entryPoint = FlatVectorIndex.NO_SLOT;

    public HierarchicalVectorIndex(
            FlatVectorIndex flatIndex,
            VectorSimilarity vectorSimilarity,
            VectorSearchProperties properties,
            Random random) {
        this.flatIndex = flatIndex;
        this.vectorSimilarity = vectorSimilarity;
        this.random = random;
        this.m = properties.getIndex().getM();
        this.maxLevel = properties.getIndex().getMaxLevel();
        this.efSearch = properties.getIndex().getEfSearch();
        log.info("Initialized hierarchical index with m={}, maxLevel={}, efSearch={}", m, maxLevel, efSearch);
    }

    @Override
    public void insert(String documentId) {
        lock.writeLock().lock();
        try {
            int slot = flatIndex.slotOf(documentId);
            if (slot == FlatVectorIndex.NO_SLOT) {
                throw new IllegalStateException("Document " + documentId + " must be stored in the flat index before indexing");
            }
            if (nodeLevels.containsKey(slot)) {
                detach(slot);
                if (entryPoint == slot) {
                    entryPoint = topNode();
                }
            }
            int level = insertNode(slot);
            log.debug("Indexed document {} at level {}", documentId, level);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String documentId) {
        lock.writeLock().lock();
        try {
            int slot = flatIndex.slotOf(documentId);
            if (slot == FlatVectorIndex.NO_SLOT || !nodeLevels.containsKey(slot)) {
                return false;
            }
            detach(slot);
            if (entryPoint == slot) {
                entryPoint = topNode();
                log.debug("Entry point {} removed, reassigned to slot {}", documentId, entryPoint);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredCandidate> search(float[] queryVector, int k, double threshold) {
        lock.readLock().lock();
        try {
            if (entryPoint == FlatVectorIndex.NO_SLOT) {
                log.debug("Index not built, performing linear search on {} vectors", flatIndex.size());
                return linearSearch(queryVector, k, threshold);
            }

            int current = entryPoint;
            double currentSimilarity = similarity(queryVector, current);

            // Жадный спуск по верхним уровням
            for (int level = levels.size() - 1; level >= 1; level--) {
                Map<Integer, int[]> layer = levels.get(level);
                if (!layer.containsKey(current)) {
                    continue;
                }
                boolean improved = true;
                while (improved) {
                    improved = false;
                    for (int neighbor : layer.get(current)) {
                        if (!layer.containsKey(neighbor) || !flatIndex.isLive(neighbor)) {
                            continue;
                        }
                        double neighborSimilarity = similarity(queryVector, neighbor);
                        if (neighborSimilarity > currentSimilarity) {
                            current = neighbor;
                            currentSimilarity = neighborSimilarity;
                            improved = true;
                        }
                    }
                }
            }

            List<Scored> frontier = searchBaseLayer(queryVector, new Scored(current, currentSimilarity), Math.max(efSearch, k));
            return frontier.stream()
                .filter(scored -> scored.similarity() >= threshold)
                .sorted(BY_SIMILARITY_DESC)
                .limit(k)
                .map(scored -> new ScoredCandidate(flatIndex.idOf(scored.slot()), scored.similarity()))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void rebuild() {
        lock.writeLock().lock();
        try {
            levels.clear();
            nodeLevels.clear();
            entryPoint = FlatVectorIndex.NO_SLOT;

            int[] slots = flatIndex.liveSlots();
            log.info("Rebuilding hierarchical index with {} documents", slots.length);
            for (int slot : slots) {
                insertNode(slot);
            }
            log.info("Rebuilt hierarchical index: {} levels, {} connections", levels.size(), countConnections());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int collectGarbage() {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (Map<Integer, int[]> layer : levels) {
                Iterator<Map.Entry<Integer, int[]>> iterator = layer.entrySet().iterator();
                while (iterator.hasNext()) {
                    Map.Entry<Integer, int[]> node = iterator.next();
                    if (!flatIndex.isLive(node.getKey()) || !nodeLevels.containsKey(node.getKey())) {
                        removed += node.getValue().length;
                        iterator.remove();
                    }
                }
                for (Map.Entry<Integer, int[]> node : layer.entrySet()) {
                    int[] neighbors = node.getValue();
                    int[] retained = Arrays.stream(neighbors)
                        .filter(neighbor -> layer.containsKey(neighbor) && flatIndex.isLive(neighbor))
                        .toArray();
                    if (retained.length != neighbors.length) {
                        removed += neighbors.length - retained.length;
                        node.setValue(retained);
                    }
                }
            }
            nodeLevels.keySet().removeIf(slot -> !flatIndex.isLive(slot));
            trimEmptyLevels();
            if (entryPoint != FlatVectorIndex.NO_SLOT && !nodeLevels.containsKey(entryPoint)) {
                entryPoint = topNode();
            }
            log.debug("Garbage collection removed {} adjacency references", removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            levels.clear();
            nodeLevels.clear();
            entryPoint = FlatVectorIndex.NO_SLOT;
            log.info("Cleared hierarchical index");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isBuilt() {
        lock.readLock().lock();
        try {
            return entryPoint != FlatVectorIndex.NO_SLOT;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return nodeLevels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int levelCount() {
        lock.readLock().lock();
        try {
            return levels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long connectionCount() {
        lock.readLock().lock();
        try {
            return countConnections();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> entryPoint() {
        lock.readLock().lock();
        try {
            return entryPoint == FlatVectorIndex.NO_SLOT
                ? Optional.empty()
                : Optional.ofNullable(flatIndex.idOf(entryPoint));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int nodeLevel(String documentId) {
        lock.readLock().lock();
        try {
            int slot = flatIndex.slotOf(documentId);
            return slot == FlatVectorIndex.NO_SLOT ? -1 : nodeLevels.getOrDefault(slot, -1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> neighbors(String documentId, int level) {
        lock.readLock().lock();
        try {
            int slot = flatIndex.slotOf(documentId);
            if (slot == FlatVectorIndex.NO_SLOT || level < 0 || level >= levels.size()) {
                return List.of();
            }
            int[] neighbors = levels.get(level).get(slot);
            if (neighbors == null) {
                return List.of();
            }
            List<String> result = new ArrayList<>(neighbors.length);
            for (int neighbor : neighbors) {
                String id = flatIndex.idOf(neighbor);
                if (id != null) {
                    result.add(id);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Places the node on levels 0..L, L drawn from a geometric distribution.
     */
    private int insertNode(int slot) {
        float[] vector = flatIndex.vector(slot);
        int level = selectLevel();
        while (levels.size() <= level) {
            levels.add(new HashMap<>());
        }

        for (int l = 0; l <= level; l++) {
            Map<Integer, int[]> layer = levels.get(l);
            int[] existing = layer.keySet().stream().mapToInt(Integer::intValue).toArray();
            int[] neighbors = nearest(vector, existing, slot, m);
            layer.put(slot, neighbors);
            for (int neighbor : neighbors) {
                addBackLink(layer, l, neighbor, slot);
            }
        }

        int entryLevel = nodeLevels.getOrDefault(entryPoint, -1);
        nodeLevels.put(slot, level);
        if (entryPoint == FlatVectorIndex.NO_SLOT || level > entryLevel) {
            entryPoint = slot;
        }
        return level;
    }

    private int selectLevel() {
        int level = 0;
        while (level < maxLevel && random.nextDouble() < LEVEL_PROBABILITY) {
            level++;
        }
        return level;
    }

    /**
     * Уровень 0 не обрезается: обратная ссылка может быть единственным входом в новый узел
     */
    private void addBackLink(Map<Integer, int[]> layer, int level, int node, int newNeighbor) {
        int[] current = layer.get(node);
        if (current == null) {
            return;
        }
        for (int neighbor : current) {
            if (neighbor == newNeighbor) {
                return;
            }
        }
        int[] extended = Arrays.copyOf(current, current.length + 1);
        extended[current.length] = newNeighbor;
        if (level > 0 && extended.length > m) {
            extended = nearest(flatIndex.vector(node), extended, node, m);
        }
        layer.put(node, extended);
    }

    /**
     * Exhaustive scan: the {@code count} live candidates most similar to the vector.
     */
    private int[] nearest(float[] vector, int[] candidates, int excludedSlot, int count) {
        List<Scored> scored = new ArrayList<>(candidates.length);
        for (int candidate : candidates) {
            if (candidate == excludedSlot) {
                continue;
            }
            float[] candidateVector = flatIndex.vector(candidate);
            if (candidateVector == null) {
                continue;
            }
            scored.add(new Scored(candidate, vectorSimilarity.cosineSimilarity(vector, candidateVector)));
        }
        scored.sort(BY_SIMILARITY_DESC);
        return scored.stream()
            .limit(count)
            .mapToInt(Scored::slot)
            .toArray();
    }

    /**
     * Beam search on level 0 starting from the node reached by the greedy descent.
     */
    private List<Scored> searchBaseLayer(float[] queryVector, Scored start, int ef) {
        Map<Integer, int[]> layer = levels.get(0);
        Set<Integer> visited = new HashSet<>();
        visited.add(start.slot());

        PriorityQueue<Scored> candidates = new PriorityQueue<>(BY_SIMILARITY_DESC);
        PriorityQueue<Scored> results = new PriorityQueue<>(BY_SIMILARITY_DESC.reversed());
        candidates.add(start);
        results.add(start);

        while (!candidates.isEmpty()) {
            Scored closest = candidates.poll();
            if (results.size() >= ef && closest.similarity() < results.peek().similarity()) {
                break;
            }
            int[] neighbors = layer.get(closest.slot());
            if (neighbors == null) {
                continue;
            }
            for (int neighbor : neighbors) {
                if (!visited.add(neighbor)) {
                    continue;
                }
                float[] neighborVector = flatIndex.vector(neighbor);
                if (neighborVector == null || !layer.containsKey(neighbor)) {
                    continue;
                }
                double neighborSimilarity = vectorSimilarity.cosineSimilarity(queryVector, neighborVector);
                if (results.size() < ef || neighborSimilarity > results.peek().similarity()) {
                    Scored scored = new Scored(neighbor, neighborSimilarity);
                    candidates.add(scored);
                    results.add(scored);
                    if (results.size() > ef) {
                        results.poll();
                    }
                }
            }
        }
        return new ArrayList<>(results);
    }

    /**
     * Линейный поиск по плоскому индексу (резервный метод)
     */
    private List<ScoredCandidate> linearSearch(float[] queryVector, int k, double threshold) {
        List<Scored> results = new ArrayList<>();
        for (int slot : flatIndex.liveSlots()) {
            double similarity = similarity(queryVector, slot);
            if (similarity >= threshold) {
                results.add(new Scored(slot, similarity));
            }
        }
        results.sort(BY_SIMILARITY_DESC);
        return results.stream()
            .limit(k)
            .map(scored -> new ScoredCandidate(flatIndex.idOf(scored.slot()), scored.similarity()))
            .toList();
    }

    private double similarity(float[] queryVector, int slot) {
        float[] vector = flatIndex.vector(slot);
        return vector == null ? Double.NEGATIVE_INFINITY : vectorSimilarity.cosineSimilarity(queryVector, vector);
    }

    private void detach(int slot) {
        for (Map<Integer, int[]> layer : levels) {
            layer.remove(slot);
        }
        nodeLevels.remove(slot);
        trimEmptyLevels();
    }

    /**
     * Node with the highest level, the lowest slot among equals
     */
    private int topNode() {
        int top = FlatVectorIndex.NO_SLOT;
        int topLevel = -1;
        for (Map.Entry<Integer, Integer> node : nodeLevels.entrySet()) {
            int slot = node.getKey();
            int level = node.getValue();
            if (level > topLevel || (level == topLevel && slot < top)) {
                top = slot;
                topLevel = level;
            }
        }
        return top;
    }

    private void trimEmptyLevels() {
        while (!levels.isEmpty() && levels.get(levels.size() - 1).isEmpty()) {
            levels.remove(levels.size() - 1);
        }
    }

    private long countConnections() {
        long connections = 0;
        for (Map<Integer, int[]> layer : levels) {
            for (int[] neighbors : layer.values()) {
                connections += neighbors.length;
            }
        }
        return connections;
    }

    private record Scored(int slot, double similarity) {
    }
}
