package com.promptvector.search.similarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorSimilarityTest {

    private final VectorSimilarity similarity = new VectorSimilarity();

    @Test
    void testCosineSimilarityOfIdenticalDirections() {
        assertEquals(1.0, similarity.cosineSimilarity(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-9);
    }

    @Test
    void testCosineSimilarityOfOppositeDirections() {
        assertEquals(-1.0, similarity.cosineSimilarity(new float[]{1, 0, 0}, new float[]{-3, 0, 0}), 1e-9);
    }

    @Test
    void testCosineSimilarityWithZeroVectorIsZero() {
        assertEquals(0.0, similarity.cosineSimilarity(new float[]{0, 0, 0}, new float[]{1, 0, 0}));
    }

    @Test
    void testCosineSimilarityRejectsDifferentDimensions() {
        assertThrows(IllegalArgumentException.class,
            () -> similarity.cosineSimilarity(new float[]{1, 0}, new float[]{1, 0, 0}));
    }

    @Test
    void testNormalizeProducesUnitVector() {
        float[] normalized = similarity.normalize(new float[]{3, 4, 0});

        assertArrayEquals(new float[]{0.6f, 0.8f, 0f}, normalized, 1e-6f);
        assertEquals(1.0, similarity.magnitude(normalized), 1e-6);
    }

    @Test
    void testNormalizeKeepsZeroVector() {
        float[] zero = new float[]{0, 0, 0};
        float[] normalized = similarity.normalize(zero);

        assertArrayEquals(zero, normalized);
        assertNotSame(zero, normalized);
    }

    @Test
    void testCentroidIsComponentWiseMean() {
        float[] centroid = similarity.centroid(List.of(new float[]{1, 0, 0}, new float[]{0, 1, 0}), 3);

        assertArrayEquals(new float[]{0.5f, 0.5f, 0f}, centroid, 1e-6f);
    }

    @Test
    void testCentroidOfNothingIsZero() {
        assertArrayEquals(new float[]{0, 0, 0}, similarity.centroid(List.of(), 3));
    }
}
