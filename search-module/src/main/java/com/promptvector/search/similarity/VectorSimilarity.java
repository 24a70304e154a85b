package com.promptvector.search.similarity;

import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class VectorSimilarity {

    /** Вычислить косинусное сходство между векторами */
    public double cosineSimilarity(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < vector1.length; i++) {
            dotProduct += (double) vector1[i] * vector2[i];
            normA += (double) vector1[i] * vector1[i];
            normB += (double) vector2[i] * vector2[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Косинусное расстояние: 1 - сходство */
    public double cosineDistance(float[] vector1, float[] vector2) {
        return 1.0 - cosineSimilarity(vector1, vector2);
    }

    public double magnitude(float[] vector) {
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns an L2-normalized copy. A zero vector is returned unchanged.
     */
    public float[] normalize(float[] vector) {
        double magnitude = magnitude(vector);
        if (magnitude == 0.0) {
            return vector.clone();
        }
        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / magnitude);
        }
        return normalized;
    }

    /**
     * Component-wise mean of the given vectors; all-zero when the collection is empty.
     */
    public float[] centroid(Collection<float[]> vectors, int dimension) {
        double[] sum = new double[dimension];
        for (float[] vector : vectors) {
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }
        float[] centroid = new float[dimension];
        if (vectors.isEmpty()) {
            return centroid;
        }
        for (int i = 0; i < dimension; i++) {
            centroid[i] = (float) (sum[i] / vectors.size());
        }
        return centroid;
    }

    /**
     * Accumulates {@code weight * vector} into {@code target}.
     */
    public void addScaled(double[] target, float[] vector, double weight) {
        for (int i = 0; i < target.length; i++) {
            target[i] += vector[i] * weight;
        }
    }
}
