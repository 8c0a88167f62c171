package com.example.ticketassist.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;
import com.example.ticketassist.exception.InvalidInputException;
import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.model.DraftResponse;
import com.example.ticketassist.model.TicketResponse;
import com.example.ticketassist.retrieval.AggregatedRetrieval;
import com.example.ticketassist.retrieval.CrossQueryAggregator;
import com.example.ticketassist.retrieval.DocumentMetadata;
import com.example.ticketassist.telemetry.TicketMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Resolves one ticket: rewrite, retrieve per query, aggregate, generate, cite, classify the
 * follow-up action, apply the safety override and validate. Synchronous; any stage failure
 * aborts the resolution and propagates to the caller.
 */
@Component
public class TicketPipeline {

    private static final Logger log = LoggerFactory.getLogger(TicketPipeline.class);

    private final QueryRewriter queryRewriter;
    private final CrossQueryAggregator aggregator;
    private final AnswerGenerator answerGenerator;
    private final ReferenceSelector referenceSelector;
    private final ActionClassifier actionClassifier;
    private final SafetyOverride safetyOverride;
    private final ResponseValidator responseValidator;
    private final TicketMetrics metrics;
    private final int referenceCount;
    private final Tracer tracer;

    public TicketPipeline(
        QueryRewriter queryRewriter,
        CrossQueryAggregator aggregator,
        AnswerGenerator answerGenerator,
        ReferenceSelector referenceSelector,
        ActionClassifier actionClassifier,
        SafetyOverride safetyOverride,
        ResponseValidator responseValidator,
        TicketMetrics metrics,
        RetrievalProperties properties
    ) {
        this.queryRewriter = queryRewriter;
        this.aggregator = aggregator;
        this.answerGenerator = answerGenerator;
        this.referenceSelector = referenceSelector;
        this.actionClassifier = actionClassifier;
        this.safetyOverride = safetyOverride;
        this.responseValidator = responseValidator;
        this.metrics = metrics;
        this.referenceCount = properties.referenceCount();
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public TicketResolution resolve(String ticketText) {
        String ticket = InvalidInputException.requireNonBlank(ticketText, "ticket_text");
        long startNanos = System.nanoTime();
        Span span = tracer.spanBuilder("resolve_ticket")
            .setAttribute("ticket.stage", "resolve")
            .setAttribute("ticket.length", (long) ticket.length())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            // 1. Rewrite into retrieval queries, falling back to the ticket itself
            List<String> queries = queryRewriter.rewrite(ticket);
            if (queries.isEmpty()) {
                log.debug("Query rewriting produced nothing usable, searching with the ticket text");
                queries = List.of(ticket);
            }
            span.setAttribute("ticket.queries", (long) queries.size());

            // 2. Retrieve, rerank and grade per query; merge across queries
            AggregatedRetrieval retrieval = aggregator.aggregate(queries);
            span.setAttribute("ticket.retrieval_quality", retrieval.assessment().quality().label());

            // 3. Grounded answer
            String answer = answerGenerator.generate(ticket, retrieval.documents());

            // 4. Citations and follow-up action
            List<String> references = referenceSelector.select(retrieval.documents(), referenceCount);
            ActionDecision decision = actionClassifier.infer(answer);
            ActionRequired inferred = ActionRequired.fromValue(decision.externalLabel())
                .orElseThrow(() -> new IllegalStateException("Unknown action label " + decision.action()));

            // 5. Poor grounding never closes a ticket silently
            ActionRequired action = safetyOverride.apply(retrieval.assessment(), inferred);
            boolean overridden = action != inferred;

            // 6. Contract check
            TicketResponse response = responseValidator.validate(
                new DraftResponse(answer, references, action.value()));

            double durationSec = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            metrics.recordRetrievalQuality(retrieval.assessment().quality().label(), queries.size());
            if (!retrieval.documents().isEmpty()) {
                DocumentMetadata.relevanceScore(retrieval.documents().get(0))
                    .ifPresent(metrics::recordTopRelevance);
            }
            metrics.recordAction(action.value(), overridden);
            metrics.recordResolution(durationSec, "resolved");

            span.setAttribute("ticket.action", action.value());
            span.setAttribute("ticket.safety_override", overridden);
            log.info("Ticket resolved: queries={} docs={} quality={} action={} override={} in {}s",
                queries.size(), retrieval.documents().size(), retrieval.assessment().quality().label(),
                action.value(), overridden, String.format("%.2f", durationSec));

            return new TicketResolution(response, queries, retrieval.documents(),
                retrieval.assessment(), decision, overridden);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.recordResolution((System.nanoTime() - startNanos) / 1_000_000_000.0,
                e.getClass().getSimpleName());
            log.error("Ticket resolution failed: {}", e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
