package com.example.ticketassist.retrieval;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;
import com.example.ticketassist.exception.InvalidInputException;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * First-pass candidate fetch for a single query. Dense/sparse fusion happens inside the
 * {@link DocumentIndex}; this stage only sizes the request and records what came back.
 */
@Component
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final DocumentIndex index;
    private final int initialK;
    private final Tracer tracer;

    public HybridRetriever(DocumentIndex index, RetrievalProperties properties) {
        this.index = index;
        this.initialK = properties.initialK();
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public List<Document> retrieve(String query) {
        return retrieve(query, initialK);
    }

    public List<Document> retrieve(String query, int k) {
        String q = InvalidInputException.requireNonBlank(query, "query");

        Span span = tracer.spanBuilder("hybrid_retrieval")
            .setAttribute("ticket.stage", "retrieve")
            .setAttribute("ticket.retrieval.initial_k", (long) k)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            List<Document> candidates = index.search(q, k);
            span.setAttribute("ticket.retrieval.candidates", (long) candidates.size());

            log.debug("Retrieved {} candidates for query: {}", candidates.size(),
                q.length() > 80 ? q.substring(0, 80) + "..." : q);
            return candidates;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("Retrieval failed: {}", e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
