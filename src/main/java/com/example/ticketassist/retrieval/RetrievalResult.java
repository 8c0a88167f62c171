package com.example.ticketassist.retrieval;

import java.util.List;

import org.springframework.ai.document.Document;

/** Reranked documents, best first, with their index-aligned relevance scores. */
public record RetrievalResult(List<Document> documents, List<Double> scores) {

    public RetrievalResult {
        if (documents.size() != scores.size()) {
            throw new IllegalArgumentException(
                "documents and scores must be index-aligned: " + documents.size() + " vs " + scores.size());
        }
        documents = List.copyOf(documents);
        scores = List.copyOf(scores);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
