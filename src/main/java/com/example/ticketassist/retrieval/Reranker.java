package com.example.ticketassist.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

@Component
public class Reranker {

    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    private final RelevanceScorer scorer;
    private final int topK;
    private final Tracer tracer;

    public Reranker(RelevanceScorer scorer, RetrievalProperties properties) {
        this.scorer = scorer;
        this.topK = properties.rerankTopK();
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public RetrievalResult rerank(String query, List<Document> candidates) {
        return rerank(query, candidates, topK);
    }

    /**
     * Scores every candidate against {@code query} and keeps the best {@code topK}. Kept documents
     * are returned as copies carrying their score under {@link DocumentMetadata#RELEVANCE_SCORE};
     * the input documents are not modified. Equal scores keep their retrieval order.
     */
    public RetrievalResult rerank(String query, List<Document> candidates, int topK) {
        if (candidates.isEmpty()) {
            return RetrievalResult.empty();
        }

        Span span = tracer.spanBuilder("rerank")
            .setAttribute("ticket.stage", "rerank")
            .setAttribute("ticket.rerank.candidates", (long) candidates.size())
            .setAttribute("ticket.rerank.top_k", (long) topK)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            List<String> texts = candidates.stream().map(DocumentMetadata::text).toList();
            List<Double> scores = scorer.scoreAll(query, texts);
            if (scores.size() != candidates.size()) {
                throw new IllegalStateException("Relevance scorer returned " + scores.size()
                    + " scores for " + candidates.size() + " candidates");
            }

            List<Integer> order = new ArrayList<>(candidates.size());
            for (int i = 0; i < candidates.size(); i++) {
                double score = scores.get(i);
                if (!Double.isFinite(score)) {
                    throw new IllegalStateException("Relevance scorer returned non-finite score " + score);
                }
                order.add(i);
            }
            // List.sort is stable, so ties stay in retrieval order
            order.sort(Comparator.comparingDouble((Integer i) -> scores.get(i)).reversed());

            int keep = Math.min(Math.max(topK, 0), order.size());
            List<Document> keptDocs = new ArrayList<>(keep);
            List<Double> keptScores = new ArrayList<>(keep);
            for (int i : order.subList(0, keep)) {
                double score = scores.get(i);
                keptDocs.add(DocumentMetadata.withRelevanceScore(candidates.get(i), score));
                keptScores.add(score);
            }

            if (!keptScores.isEmpty()) {
                span.setAttribute("ticket.rerank.top_score", keptScores.get(0));
            }
            log.debug("Reranked {} candidates, kept {} (top={})", candidates.size(), keep,
                keptScores.isEmpty() ? "n/a" : keptScores.get(0));
            return new RetrievalResult(keptDocs, keptScores);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
