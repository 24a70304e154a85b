package com.promptvector.search.embedding;

import com.promptvector.search.similarity.VectorSimilarity;

import java.util.Locale;

/**
 * Offline embedding without a model: each lower-cased word is hashed into one of
 * D buckets and contributes {@code 1 / (position + 1)}; the result is normalized.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;
    private final VectorSimilarity similarity;

    public HashingEmbeddingProvider(int dimension, VectorSimilarity similarity) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        this.dimension = dimension;
        this.similarity = similarity;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        String[] words = text.toLowerCase(Locale.ROOT).trim().split("\\s+");
        for (int position = 0; position < words.length; position++) {
            if (words[position].isEmpty()) {
                continue;
            }
            int bucket = (int) (Math.abs((long) words[position].hashCode()) % dimension);
            vector[bucket] += 1.0f / (position + 1);
        }
        return similarity.normalize(vector);
    }
}
