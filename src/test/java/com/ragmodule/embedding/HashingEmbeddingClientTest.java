package com.ragmodule.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class HashingEmbeddingClientTest {

    @Test
    void shouldProduceDeterministicUnitVectors() {
        HashingEmbeddingClient client = new HashingEmbeddingClient(32);
        List<Optional<float[]>> first = client.embed(List.of("Vector search with Qdrant"));
        List<Optional<float[]>> second = client.embed(List.of("Vector search with Qdrant"));

        float[] vector = first.get(0).orElseThrow();
        assertEquals(32, vector.length);
        assertArrayEquals(vector, second.get(0).orElseThrow());

        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        assertEquals(1.0, norm, 1e-5);
    }

    @Test
    void shouldLeaveSlotEmptyForBlankText() {
        HashingEmbeddingClient client = new HashingEmbeddingClient(16);
        List<Optional<float[]>> vectors = client.embed(List.of("hello", "   ", "world"));

        assertEquals(3, vectors.size());
        assertTrue(vectors.get(0).isPresent());
        assertTrue(vectors.get(1).isEmpty());
        assertTrue(vectors.get(2).isPresent());
    }

    @Test
    void shouldRankSharedVocabularyHigher() {
        HashingEmbeddingClient client = new HashingEmbeddingClient(256);
        List<Optional<float[]>> vectors = client.embed(List.of(
                "UBC is a public research university.",
                "Tell me about UBC university",
                "Bananas are yellow fruit"));

        float[] document = vectors.get(0).orElseThrow();
        double related = dot(document, vectors.get(1).orElseThrow());
        double unrelated = dot(document, vectors.get(2).orElseThrow());
        assertTrue(related > unrelated);
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
