package com.example.ticketassist.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs retrieve, rerank and evaluate for every rewritten query, then merges the results into one
 * ranked document list and one aggregate quality verdict.
 *
 * <p>Queries may be fanned out concurrently; per-query outcomes are always folded in query order.
 */
@Component
public class CrossQueryAggregator {

    private static final Logger log = LoggerFactory.getLogger(CrossQueryAggregator.class);

    private static final Comparator<Document> BY_RELEVANCE_DESC = Comparator
        .comparingDouble((Document d) -> DocumentMetadata.relevanceScore(d).orElse(Double.NEGATIVE_INFINITY))
        .reversed();

    private final HybridRetriever retriever;
    private final Reranker reranker;
    private final QualityEvaluator evaluator;
    private final RetrievalProperties properties;
    private final Tracer tracer;

    public CrossQueryAggregator(HybridRetriever retriever, Reranker reranker,
                                QualityEvaluator evaluator, RetrievalProperties properties) {
        this.retriever = retriever;
        this.reranker = reranker;
        this.evaluator = evaluator;
        this.properties = properties;
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public AggregatedRetrieval aggregate(List<String> queries) {
        Span span = tracer.spanBuilder("cross_query_aggregate")
            .setAttribute("ticket.stage", "aggregate")
            .setAttribute("ticket.queries", (long) queries.size())
            .setAttribute("ticket.parallel", properties.parallelQueries())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            List<QueryRetrieval> perQuery = properties.parallelQueries() && queries.size() > 1
                ? retrieveConcurrently(queries)
                : queries.stream().map(this::retrieveOne).toList();

            List<Document> ranked = rankGlobally(perQuery, properties.finalK());
            QualityAssessment assessment = foldQuality(perQuery, properties.partialQualityUpgrades());

            span.setAttribute("ticket.final_documents", (long) ranked.size());
            span.setAttribute("ticket.retrieval_quality", assessment.quality().label());
            log.debug("Aggregated {} queries into {} documents (quality={})",
                queries.size(), ranked.size(), assessment.quality().label());

            return new AggregatedRetrieval(ranked, assessment, perQuery);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    QueryRetrieval retrieveOne(String query) {
        List<Document> candidates = retriever.retrieve(query);
        RetrievalResult reranked = reranker.rerank(query, candidates);
        QualityAssessment assessment = evaluator.evaluate(reranked);
        log.debug("Query '{}' -> {} docs, quality={}", query, reranked.documents().size(),
            assessment.quality().label());
        return new QueryRetrieval(query, reranked, assessment);
    }

    private List<QueryRetrieval> retrieveConcurrently(List<String> queries) {
        // worker threads inherit the aggregate span so per-query spans nest under it
        Context parent = Context.current();
        // flatMapSequential subscribes eagerly but emits in source order
        return Flux.fromIterable(queries)
            .flatMapSequential(q -> Mono.fromCallable(parent.wrap(() -> retrieveOne(q)))
                .subscribeOn(Schedulers.boundedElastic()))
            .collectList()
            .block();
    }

    /**
     * Pools every query's documents keyed by exact content. A later duplicate replaces the
     * earlier one's metadata but keeps its pool position; the pool is then stably sorted by
     * relevance score, documents without a score last.
     */
    static List<Document> rankGlobally(List<QueryRetrieval> perQuery, int finalK) {
        Map<String, Document> pool = new LinkedHashMap<>();
        for (QueryRetrieval qr : perQuery) {
            for (Document doc : qr.result().documents()) {
                pool.put(DocumentMetadata.text(doc), doc);
            }
        }

        List<Document> ranked = new ArrayList<>(pool.values());
        ranked.sort(BY_RELEVANCE_DESC);
        return List.copyOf(ranked.subList(0, Math.min(Math.max(finalK, 0), ranked.size())));
    }

    /**
     * Best-of fold over per-query verdicts, in query order. Any {@code good} verdict replaces the
     * running best, so the last one wins. When {@code partialUpgrades} is set, the first
     * {@code partially_good} verdict replaces a best that is still {@code poor}.
     */
    static QualityAssessment foldQuality(List<QueryRetrieval> perQuery, boolean partialUpgrades) {
        QualityAssessment best = QualityAssessment.poor(QualityAssessment.NO_RELEVANT_RETRIEVAL);
        for (QueryRetrieval qr : perQuery) {
            QualityAssessment current = qr.assessment();
            if (current.is(RetrievalQuality.GOOD)) {
                best = current;
            } else if (partialUpgrades
                && current.is(RetrievalQuality.PARTIALLY_GOOD)
                && best.is(RetrievalQuality.POOR)) {
                best = current;
            }
        }
        return best;
    }
}
