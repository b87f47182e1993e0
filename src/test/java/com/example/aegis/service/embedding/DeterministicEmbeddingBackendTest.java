package com.example.aegis.service.embedding;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicEmbeddingBackendTest {

    @Test
    void sameText_yieldsBitIdenticalVectors() {
        var backend = new DeterministicEmbeddingBackend("m", 64, true);
        float[] first = backend.embed("hello world");
        float[] second = backend.embed("hello world");
        assertArrayEquals(first, second);

        var other = new DeterministicEmbeddingBackend("m", 64, true);
        assertArrayEquals(first, other.embed("hello world"));
    }

    @Test
    void everyVector_hasConfiguredDimension() {
        var backend = new DeterministicEmbeddingBackend("m", 24, false);
        List<float[]> vectors = backend.embedBatch(Arrays.asList("a", "bb", "", "a longer sentence here"));
        assertEquals(4, vectors.size());
        for (float[] vector : vectors) {
            assertEquals(24, vector.length);
        }
        assertEquals(24, backend.getDimension());
    }

    @Test
    void normalized_vectorHasUnitNorm() {
        var backend = new DeterministicEmbeddingBackend("m", 128, true);
        float[] vector = backend.embed("normalize me");
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        assertEquals(1.0, Math.sqrt(norm), 1e-4);
    }

    @Test
    void unnormalized_componentsMatchKnownDigestValues() {
        // sha256("hello:i") leading four bytes: 49f2b5d7, c06ef95f, 953cd22e, 7d844c51
        var backend = new DeterministicEmbeddingBackend("m", 4, false);
        float[] vector = backend.embed("hello");
        assertEquals(-0.42228056909516454f, vector[0], 1e-7f);
        assertEquals(0.5033866609446704f, vector[1], 1e-7f);
        assertEquals(0.16591861005872488f, vector[2], 1e-7f);
        assertEquals(-0.01940008206292987f, vector[3], 1e-7f);
    }

    @Test
    void unnormalized_componentsStayWithinHashRange() {
        var backend = new DeterministicEmbeddingBackend("m", 32, false);
        for (float v : backend.embed("range")) {
            assertTrue(v >= -1.0f && v <= 1.0f, "component out of range: " + v);
        }
    }

    @Test
    void emptyText_mapsToZeroVector() {
        var backend = new DeterministicEmbeddingBackend("m", 16, true);
        assertArrayEquals(new float[16], backend.embed(""));
    }

    @Test
    void differentTexts_yieldDifferentVectors() {
        var backend = new DeterministicEmbeddingBackend("m", 16, true);
        assertFalse(Arrays.equals(backend.embed("a"), backend.embed("b")));
    }

    @Test
    void batch_preservesOrderAndDuplicates() {
        var backend = new DeterministicEmbeddingBackend("m", 16, true);
        List<float[]> vectors = backend.embedBatch(Arrays.asList("x", "y", "x"));
        assertArrayEquals(vectors.get(0), vectors.get(2));
        assertArrayEquals(backend.embed("y"), vectors.get(1));
    }

    @Test
    void nonPositiveDimension_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DeterministicEmbeddingBackend("m", 0, true));
    }
}
