package com.example.ticketassist.retrieval;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.ai.content.Media;
import org.springframework.ai.document.Document;
import org.springframework.util.MimeTypeUtils;

import com.example.ticketassist.config.RetrievalProperties;

import static org.junit.jupiter.api.Assertions.*;

class DocumentMetadataTest {

    private static Document diagram() {
        Media media = Media.builder()
            .mimeType(MimeTypeUtils.IMAGE_PNG)
            .data(new byte[] {1, 2, 3})
            .build();
        return new Document(media, Map.of("category", "runbooks", "section", "DNS diagram"));
    }

    @Test
    void relevanceScoreCopyKeepsTextDocumentIntact() {
        var doc = new Document("chunk-7", "Refunds take 5 days.", Map.of("category", "billing"));

        Document scored = DocumentMetadata.withRelevanceScore(doc, 3.25);

        assertEquals("chunk-7", scored.getId());
        assertEquals("Refunds take 5 days.", scored.getText());
        assertEquals("billing", scored.getMetadata().get("category"));
        assertEquals(3.25, DocumentMetadata.relevanceScore(scored).getAsDouble());
        assertEquals(3.25, scored.getScore());
        assertTrue(DocumentMetadata.relevanceScore(doc).isEmpty());
    }

    @Test
    void relevanceScoreCopyKeepsMedia() {
        Document doc = diagram();

        Document scored = DocumentMetadata.withRelevanceScore(doc, 1.5);

        assertSame(doc.getMedia(), scored.getMedia());
        assertNull(scored.getText());
        assertEquals(doc.getId(), scored.getId());
        assertEquals(1.5, scored.getMetadata().get(DocumentMetadata.RELEVANCE_SCORE));
    }

    @Test
    void mediaDocumentsSurviveReranking() {
        var reranker = new Reranker((q, t) -> t.isEmpty() ? 0.5 : 2.0, RetrievalProperties.defaults());

        RetrievalResult result = reranker.rerank("dns", List.of(diagram(), new Document("DNS changes", Map.of())));

        assertEquals(List.of(2.0, 0.5), result.scores());
        assertNotNull(result.documents().get(1).getMedia());
    }

    @Test
    void categoryAndTextFallbacks() {
        Document doc = diagram();

        assertEquals("runbooks", DocumentMetadata.category(doc));
        assertEquals("unknown", DocumentMetadata.category(new Document("x", Map.of())));
        assertEquals("", DocumentMetadata.text(doc));
    }
}
