package com.promptvector.search.embedding;

/**
 * Turns query text into a vector of the engine dimension.
 */
public interface EmbeddingProvider {

    /**
     * @param text непустой текст запроса
     * @return вектор размерности D
     */
    float[] embed(String text);
}
