package com.example.ticketassist.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

@Component
public class NormalizedEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(NormalizedEmbeddingClient.class);

    private final EmbeddingModel embeddingModel;
    private final Tracer tracer;

    public NormalizedEmbeddingClient(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    @Override
    public float[] embed(String text) {
        Span span = tracer.spanBuilder("embed")
            .setAttribute("ticket.embedding.input_chars", (long) text.length())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            float[] vector = Vectors.normalize(embeddingModel.embed(text));
            span.setAttribute("ticket.embedding.dimensions", (long) vector.length);
            log.trace("Embedded {} chars into {} dimensions", text.length(), vector.length);
            return vector;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
