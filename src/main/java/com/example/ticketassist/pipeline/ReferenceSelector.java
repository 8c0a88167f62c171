package com.example.ticketassist.pipeline;

import java.util.List;
import java.util.Map;

import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.retrieval.DocumentMetadata;

/** Formats citations for the first {@code k} documents, in the order given. */
@Component
public class ReferenceSelector {

    public static final int DEFAULT_K = 3;

    public List<String> select(List<Document> documents) {
        return select(documents, DEFAULT_K);
    }

    public List<String> select(List<Document> documents, int k) {
        return documents.stream()
            .limit(Math.max(k, 0))
            .map(ReferenceSelector::format)
            .toList();
    }

    /** {@code "<category>: <section>[ | § <subsection>] | file=<source_file>"} */
    static String format(Document doc) {
        Map<String, Object> metadata = doc.getMetadata();
        String category = valueOr(metadata, DocumentMetadata.CATEGORY, DocumentMetadata.UNKNOWN_CATEGORY);
        String section = valueOr(metadata, DocumentMetadata.SECTION, "Unknown Doc");
        String sourceFile = valueOr(metadata, DocumentMetadata.SOURCE_FILE, "unknown_file");
        Object subsection = metadata.get(DocumentMetadata.SUBSECTION);

        var sb = new StringBuilder(category).append(": ").append(section);
        if (subsection != null && !subsection.toString().isEmpty()) {
            sb.append(" | § ").append(subsection);
        }
        sb.append(" | file=").append(sourceFile);
        return sb.toString();
    }

    private static String valueOr(Map<String, Object> metadata, String key, String fallback) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : fallback;
    }
}
