package com.example.ticketassist.retrieval;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.ticketassist.config.RerankerProperties;
import com.example.ticketassist.telemetry.CollaboratorErrors;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Cross-encoder served by a text-embeddings-inference style {@code /rerank} endpoint.
 *
 * <p>Raw logits are requested ({@code raw_scores=true}) because the retrieval-quality thresholds
 * are calibrated on unnormalized ms-marco scores.
 */
@Component
public class CrossEncoderClient implements RelevanceScorer {

    private static final Logger log = LoggerFactory.getLogger(CrossEncoderClient.class);
    private static final ParameterizedTypeReference<List<RerankHit>> HITS = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final RerankerProperties properties;
    private final Tracer tracer;

    record RerankRequest(
        String query,
        List<String> texts,
        @JsonProperty("raw_scores") boolean rawScores,
        boolean truncate
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RerankHit(int index, double score) {}

    public CrossEncoderClient(WebClient.Builder builder, RerankerProperties properties) {
        this.webClient = builder.baseUrl(properties.baseUrl()).build();
        this.properties = properties;
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
        log.info("Cross-encoder reranker: url={} model={} timeout={}",
            properties.baseUrl(), properties.model(), properties.timeout());
    }

    @Override
    public double score(String query, String text) {
        return scoreAll(query, List.of(text)).get(0);
    }

    @Override
    public List<Double> scoreAll(String query, List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        Span span = tracer.spanBuilder("cross_encoder.rerank")
            .setAttribute("ticket.reranker.model", properties.model())
            .setAttribute("ticket.reranker.pairs", (long) texts.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            List<RerankHit> hits = webClient.post()
                .uri("/rerank")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RerankRequest(query, texts, true, true))
                .retrieve()
                .bodyToMono(HITS)
                .block(properties.timeout());

            return alignScores(hits, texts.size());

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute("error.type", CollaboratorErrors.classify(e));
            throw e;

        } finally {
            span.end();
        }
    }

    /** The endpoint returns hits sorted by score; put them back in request order. */
    static List<Double> alignScores(List<RerankHit> hits, int expected) {
        if (hits == null || hits.size() != expected) {
            throw new IllegalStateException("Reranker returned " + (hits == null ? 0 : hits.size())
                + " scores for " + expected + " passages");
        }
        Double[] aligned = new Double[expected];
        for (RerankHit hit : hits) {
            if (hit.index() < 0 || hit.index() >= expected || aligned[hit.index()] != null) {
                throw new IllegalStateException("Reranker returned invalid passage index " + hit.index());
            }
            aligned[hit.index()] = hit.score();
        }
        return Arrays.asList(aligned);
    }
}
