package com.example.ticketassist.retrieval;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

import org.springframework.ai.document.Document;

/**
 * Metadata keys written by the ingestion job, plus the {@code relevance_score} key the
 * reranker attaches to kept documents.
 */
public final class DocumentMetadata {

    public static final String CATEGORY = "category";
    public static final String SOURCE_FILE = "source_file";
    public static final String SECTION = "section";
    public static final String SUBSECTION = "subsection";
    public static final String CHUNK_ID = "chunk_id";
    public static final String RELEVANCE_SCORE = "relevance_score";

    public static final String UNKNOWN_CATEGORY = "unknown";

    private DocumentMetadata() {
    }

    public static String category(Document doc) {
        Object value = doc.getMetadata().get(CATEGORY);
        return value != null ? value.toString() : UNKNOWN_CATEGORY;
    }

    public static OptionalDouble relevanceScore(Document doc) {
        Object value = doc.getMetadata().get(RELEVANCE_SCORE);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        return OptionalDouble.empty();
    }

    /** Copy of {@code doc}, text or media included, carrying {@code score} as its relevance score. */
    static Document withRelevanceScore(Document doc, double score) {
        Map<String, Object> metadata = new HashMap<>(doc.getMetadata());
        metadata.put(RELEVANCE_SCORE, score);
        return doc.mutate()
            .metadata(metadata)
            .score(score)
            .build();
    }

    static String text(Document doc) {
        return doc.getText() != null ? doc.getText() : "";
    }
}
