package com.example.ticketassist.embedding;

import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class VectorsTest {

    @Test
    void normalizeReturnsUnitLengthCopy() {
        float[] input = {3f, 4f};

        float[] unit = Vectors.normalize(input);

        assertArrayEquals(new float[] {0.6f, 0.8f}, unit, 1e-6f);
        assertArrayEquals(new float[] {3f, 4f}, input);
        assertEquals(1.0, Vectors.dot(unit, unit), 1e-6);
    }

    @Test
    void zeroVectorStaysZero() {
        assertArrayEquals(new float[] {0f, 0f, 0f}, Vectors.normalize(new float[3]));
    }

    @Test
    void dotRejectsDimensionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Vectors.dot(new float[2], new float[3]));
    }

    @Test
    void embeddingClientNormalizesModelOutput() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed("reset my password")).thenReturn(new float[] {0f, 2f, 0f});

        float[] vector = new NormalizedEmbeddingClient(model).embed("reset my password");

        assertArrayEquals(new float[] {0f, 1f, 0f}, vector, 1e-6f);
    }

    @Test
    void embeddingFailurePropagates() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed("text")).thenThrow(new IllegalStateException("model not loaded"));

        assertThrows(IllegalStateException.class, () -> new NormalizedEmbeddingClient(model).embed("text"));
    }
}
