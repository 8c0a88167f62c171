package com.example.ticketassist.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.ActionProperties;
import com.example.ticketassist.embedding.EmbeddingClient;
import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.model.Scores;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Picks a follow-up action by embedding the answer and matching it against the action
 * prototypes. Deterministic for a deterministic embedding model; no generation call involved.
 */
@Component
public class ActionClassifier {

    private static final Logger log = LoggerFactory.getLogger(ActionClassifier.class);

    private final EmbeddingClient embeddingClient;
    private final ActionPrototypeIndex prototypes;
    private final double threshold;
    private final Tracer tracer;

    public ActionClassifier(EmbeddingClient embeddingClient, ActionPrototypeIndex prototypes,
                            ActionProperties properties) {
        this.embeddingClient = embeddingClient;
        this.prototypes = prototypes;
        this.threshold = properties.threshold();
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public ActionDecision infer(String answerText) {
        return infer(answerText, threshold);
    }

    public ActionDecision infer(String answerText, double threshold) {
        if (answerText == null || answerText.isBlank()) {
            return ActionDecision.abstain(0.0);
        }

        Span span = tracer.spanBuilder("classify_action")
            .setAttribute("ticket.stage", "classify_action")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            float[] answer = embeddingClient.embed(answerText);

            ActionRequired best = null;
            double bestScore = 0.0;
            for (ActionRequired action : prototypes.actions()) {
                double similarity = prototypes.maxSimilarity(action, answer);
                if (similarity > bestScore) {
                    bestScore = similarity;
                    best = action;
                }
            }

            double confidence = Scores.round3(Math.min(bestScore, 1.0));
            ActionDecision decision = best == null || bestScore < threshold
                ? ActionDecision.abstain(confidence)
                : new ActionDecision(best.value(), confidence);

            span.setAttribute("ticket.action", decision.action());
            span.setAttribute("ticket.action_confidence", decision.confidence());
            log.debug("Inferred action {} (confidence={}, threshold={})",
                decision.action(), decision.confidence(), threshold);
            return decision;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
