package com.promptvector.search.index;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact id → vector store, the ground truth for all similarity math.
 * <p>
 * Vectors live in an arena addressed by dense integer slots. Removing a document
 * leaves a tombstone; slots are only renumbered by {@link #compact()}, so slot
 * numbers held by the hierarchical index never point at another document until
 * the next maintenance run rebuilds it.
 */
@Component
@Slf4j
public class FlatVectorIndex {

    public static final int NO_SLOT = -1;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** slot → вектор (null для удалённых) */
    private final List<float[]> vectors = new ArrayList<>();

    /** slot → id (null для удалённых) */
    private final List<String> ids = new ArrayList<>();

    private final Map<String, Integer> slotById = new HashMap<>();

    /**
     * Inserts or overwrites the vector of a document.
     * @return slot of the document
     */
    public int put(String id, float[] vector) {
        lock.writeLock().lock();
        try {
            Integer existing = slotById.get(id);
            if (existing != null) {
                vectors.set(existing, vector);
                return existing;
            }
            int slot = vectors.size();
            vectors.add(vector);
            ids.add(id);
            slotById.put(id, slot);
            return slot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(String id) {
        lock.writeLock().lock();
        try {
            Integer slot = slotById.remove(id);
            if (slot == null) {
                return false;
            }
            vectors.set(slot, null);
            ids.set(slot, null);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<float[]> get(String id) {
        lock.readLock().lock();
        try {
            Integer slot = slotById.get(id);
            return slot == null ? Optional.empty() : Optional.of(vectors.get(slot));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return slotById.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return slot of the document or {@link #NO_SLOT}
     */
    public int slotOf(String id) {
        lock.readLock().lock();
        try {
            Integer slot = slotById.get(id);
            return slot == null ? NO_SLOT : slot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return vector at the slot, null for a tombstone or an unknown slot
     */
    public float[] vector(int slot) {
        lock.readLock().lock();
        try {
            return slot >= 0 && slot < vectors.size() ? vectors.get(slot) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String idOf(int slot) {
        lock.readLock().lock();
        try {
            return slot >= 0 && slot < ids.size() ? ids.get(slot) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isLive(int slot) {
        return vector(slot) != null;
    }

    /**
     * Live slots in ascending order, i.e. in insertion order of their documents.
     */
    public int[] liveSlots() {
        lock.readLock().lock();
        try {
            int[] live = new int[slotById.size()];
            int position = 0;
            for (int slot = 0; slot < vectors.size(); slot++) {
                if (vectors.get(slot) != null) {
                    live[position++] = slot;
                }
            }
            return live;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of all live id → vector pairs in slot order.
     */
    public Map<String, float[]> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, float[]> snapshot = new LinkedHashMap<>();
            for (int slot = 0; slot < vectors.size(); slot++) {
                if (vectors.get(slot) != null) {
                    snapshot.put(ids.get(slot), vectors.get(slot));
                }
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return slotById.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Количество слотов, включая удалённые */
    public int capacity() {
        lock.readLock().lock();
        try {
            return vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops tombstones and renumbers the remaining slots densely, preserving order.
     * Any slot-based structure must be rebuilt afterwards.
     * @return number of reclaimed slots
     */
    public int compact() {
        lock.writeLock().lock();
        try {
            int reclaimed = vectors.size() - slotById.size();
            if (reclaimed == 0) {
                return 0;
            }
            List<float[]> liveVectors = new ArrayList<>(slotById.size());
            List<String> liveIds = new ArrayList<>(slotById.size());
            for (int slot = 0; slot < vectors.size(); slot++) {
                if (vectors.get(slot) != null) {
                    slotById.put(ids.get(slot), liveVectors.size());
                    liveVectors.add(vectors.get(slot));
                    liveIds.add(ids.get(slot));
                }
            }
            vectors.clear();
            vectors.addAll(liveVectors);
            ids.clear();
            ids.addAll(liveIds);
            log.debug("Compacted flat index: reclaimed {} slots, {} live", reclaimed, liveVectors.size());
            return reclaimed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            vectors.clear();
            ids.clear();
            slotById.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
