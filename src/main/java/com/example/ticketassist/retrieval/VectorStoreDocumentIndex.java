package com.example.ticketassist.retrieval;

import java.util.List;

import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Component;

/**
 * Dense-only index: cosine similarity over the pgvector collection. No sparse (BM25) leg is
 * fused in here; a fusing index would be another {@link DocumentIndex} implementation.
 */
@Component
public class VectorStoreDocumentIndex implements DocumentIndex {

    private final VectorStore vectorStore;

    public VectorStoreDocumentIndex(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public List<Document> search(String query, int k) {
        List<Document> results = vectorStore.similaritySearch(
            SearchRequest.builder()
                .query(query)
                .topK(k)
                .build()
        );
        return results != null ? results : List.of();
    }
}
