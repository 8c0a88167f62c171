package com.example.ticketassist.pipeline;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Component;

import com.example.ticketassist.exception.GenerationFormatException;
import com.example.ticketassist.exception.GenerationFormatException.Reason;
import com.example.ticketassist.exception.InvalidInputException;
import com.example.ticketassist.llm.GenerationClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Produces the answer text for a ticket, grounded in the final ranked documents.
 *
 * <p>The backend is asked for {@code {"answer": "..."}} and nothing else. Output is checked in
 * two steps: it must parse as exactly one JSON document, then that document must be an object
 * with a string {@code answer}. Each failure has its own {@link Reason}.
 */
@Component
public class AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);
    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    static final String ANSWER_FIELD = "answer";

    private final GenerationClient generationClient;
    private final Tracer tracer;

    public AnswerGenerator(GenerationClient generationClient) {
        this.generationClient = generationClient;
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public String generate(String ticketText, List<Document> documents) {
        String ticket = InvalidInputException.requireNonBlank(ticketText, "ticket_text");

        Span span = tracer.spanBuilder("generate_answer")
            .setAttribute("ticket.stage", "generate")
            .setAttribute("ticket.context_documents", (long) documents.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            String prompt = Prompts.GROUNDED_ANSWER.formatted(ticket, buildContext(documents));
            String answer = extractAnswer(generationClient.complete(prompt));

            span.setAttribute("ticket.answer_chars", (long) answer.length());
            log.debug("Generated answer ({} chars) from {} context documents", answer.length(), documents.size());
            return answer;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            if (e instanceof GenerationFormatException gfe) {
                span.setAttribute("error.type", gfe.reason().name().toLowerCase());
            }
            throw e;

        } finally {
            span.end();
        }
    }

    static String buildContext(List<Document> documents) {
        String context = documents.stream()
            .map(d -> d.getText() != null ? d.getText().strip() : "")
            .collect(Collectors.joining("\n\n"));
        return context.isEmpty() ? Prompts.NO_CONTEXT : context;
    }

    static String extractAnswer(String raw) {
        JsonNode root;
        try {
            root = raw != null ? mapper.readTree(raw) : null;
        } catch (JsonProcessingException e) {
            throw new GenerationFormatException(Reason.MALFORMED_JSON,
                "LLM did not return valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new GenerationFormatException(Reason.MALFORMED_JSON, "LLM returned no JSON content");
        }

        JsonNode answer = root.isObject() ? root.get(ANSWER_FIELD) : null;
        if (answer == null || !answer.isTextual()) {
            throw new GenerationFormatException(Reason.MISSING_ANSWER,
                "LLM JSON has no string `" + ANSWER_FIELD + "` field");
        }
        return answer.asText().strip();
    }
}
