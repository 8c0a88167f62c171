package com.example.ticketassist.embedding;

/**
 * Text-to-vector embedding. Returned vectors are L2-normalized and share one fixed dimension,
 * so a dot product between two of them is their cosine similarity.
 */
@FunctionalInterface
public interface EmbeddingClient {

    float[] embed(String text);
}
