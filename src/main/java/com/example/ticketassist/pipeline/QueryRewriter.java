package com.example.ticketassist.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ticketassist.config.RetrievalProperties;
import com.example.ticketassist.exception.InvalidInputException;
import com.example.ticketassist.llm.GenerationClient;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Expands a ticket into up to {@code maxQueries} retrieval-oriented search strings.
 * May return an empty list; choosing a fallback query is up to the caller.
 */
@Component
public class QueryRewriter {

    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);
    private static final Pattern BULLET_PREFIX = Pattern.compile("^[-•*]+");
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^\\d+[.)]\\s*");

    private final GenerationClient generationClient;
    private final int maxQueries;
    private final Tracer tracer;

    public QueryRewriter(GenerationClient generationClient, RetrievalProperties properties) {
        this.generationClient = generationClient;
        this.maxQueries = properties.maxQueries();
        this.tracer = GlobalOpenTelemetry.getTracer("ticket-assist");
    }

    public List<String> rewrite(String ticketText) {
        String ticket = InvalidInputException.requireNonBlank(ticketText, "ticket_text");

        Span span = tracer.spanBuilder("rewrite_queries")
            .setAttribute("ticket.stage", "rewrite")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            String raw = generationClient.complete(Prompts.QUERY_REWRITE.formatted(ticket));
            List<String> queries = parseQueries(raw, maxQueries);

            span.setAttribute("ticket.rewritten_queries", (long) queries.size());
            log.debug("Rewrote ticket into {} queries: {}", queries.size(), queries);
            return queries;

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    /**
     * One query per non-blank line, with leading bullets and {@code "1."} / {@code "2)"} list
     * numbering removed. Exact duplicates are dropped, first occurrence kept.
     */
    static List<String> parseQueries(String raw, int limit) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        Set<String> seen = new LinkedHashSet<>();
        for (String line : raw.split("\\R")) {
            String s = line.strip();
            if (s.isEmpty()) {
                continue;
            }
            s = BULLET_PREFIX.matcher(s).replaceFirst("").strip();
            s = NUMBER_PREFIX.matcher(s).replaceFirst("");
            if (!s.isEmpty()) {
                seen.add(s);
            }
        }

        List<String> queries = new ArrayList<>(seen);
        return List.copyOf(queries.subList(0, Math.min(limit, queries.size())));
    }
}
