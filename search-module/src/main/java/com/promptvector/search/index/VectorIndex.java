package com.promptvector.search.index;

import java.util.List;
import java.util.Optional;

/**
 * Интерфейс приближённого индекса поверх {@link FlatVectorIndex}.
 * Vectors are always read from the flat index; the approximate index only keeps topology.
 */
public interface VectorIndex {

    /**
     * Добавить (или переиндексировать) документ, вектор которого уже лежит в плоском индексе
     * @param documentId ID документа
     */
    void insert(String documentId);

    /**
     * Удалить узел документа. Must be called before the flat index drops the vector.
     * @param documentId ID документа
     * @return true если узел был в индексе
     */
    boolean remove(String documentId);

    /**
     * Поиск ближайших соседей
     * @param queryVector нормализованный вектор запроса
     * @param k максимальное число результатов
     * @param threshold минимальное косинусное сходство
     * @return кандидаты по убыванию сходства
     */
    List<ScoredCandidate> search(float[] queryVector, int k, double threshold);

    /**
     * Полная перестройка индекса по содержимому плоского индекса
     */
    void rebuild();

    /**
     * Remove adjacency references to documents that are no longer in the flat index
     * @return number of removed references
     */
    int collectGarbage();

    /**
     * Очистить индекс
     */
    void clear();

    /**
     * Проверить, построен ли индекс (есть точка входа)
     */
    boolean isBuilt();

    /** Количество узлов на нулевом уровне */
    int size();

    int levelCount();

    /** Общее число рёбер на всех уровнях */
    long connectionCount();

    Optional<String> entryPoint();

    /**
     * Верхний уровень узла документа, -1 если узла нет
     */
    int nodeLevel(String documentId);

    /**
     * Live outgoing neighbours of a document on the given level, empty if the node is not there
     */
    List<String> neighbors(String documentId, int level);
}
