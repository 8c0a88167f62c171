package com.example.ticketassist.retrieval;

import java.util.List;

import org.springframework.ai.document.Document;

/**
 * Pre-populated search index over the support documentation. Implementations decide how dense
 * and sparse signals are combined; callers only see the fused, best-first candidate list.
 */
@FunctionalInterface
public interface DocumentIndex {

    List<Document> search(String query, int k);
}
