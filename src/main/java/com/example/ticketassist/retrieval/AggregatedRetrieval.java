package com.example.ticketassist.retrieval;

import java.util.List;

import org.springframework.ai.document.Document;

/**
 * Cross-query retrieval outcome: the globally ranked, deduplicated documents used for grounding,
 * the aggregate quality verdict, and the per-query outcomes in query order.
 */
public record AggregatedRetrieval(
    List<Document> documents,
    QualityAssessment assessment,
    List<QueryRetrieval> perQuery
) {

    public AggregatedRetrieval {
        documents = List.copyOf(documents);
        perQuery = List.copyOf(perQuery);
    }
}
