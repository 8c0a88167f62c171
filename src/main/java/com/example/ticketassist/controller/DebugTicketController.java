package com.example.ticketassist.controller;

import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.example.ticketassist.model.TicketResponse;
import com.example.ticketassist.pipeline.ActionDecision;
import com.example.ticketassist.pipeline.TicketResolution;
import com.example.ticketassist.retrieval.QualityAssessment;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.core.publisher.Mono;

/** Inspection view of a resolution, for local debugging only. */
@RestController
@Profile("debug-endpoints")
public class DebugTicketController {

    private final TicketController ticketController;

    public DebugTicketController(TicketController ticketController) {
        this.ticketController = ticketController;
    }

    public record RankedDocument(String content, Map<String, Object> metadata) {}

    public record TicketDiagnostics(
        TicketResponse response,
        @JsonProperty("rewritten_queries") List<String> rewrittenQueries,
        @JsonProperty("reranked_docs") List<RankedDocument> rerankedDocs,
        @JsonProperty("retrieval_eval") QualityAssessment retrievalEval,
        @JsonProperty("action_decision") ActionDecision actionDecision,
        @JsonProperty("safety_override") boolean safetyOverride
    ) {}

    @PostMapping("/resolve-ticket/debug")
    public Mono<TicketDiagnostics> resolveWithDiagnostics(@RequestBody TicketController.TicketRequest request) {
        return ticketController.resolveInternal(request).map(DebugTicketController::toDiagnostics);
    }

    static TicketDiagnostics toDiagnostics(TicketResolution resolution) {
        List<RankedDocument> docs = resolution.finalDocuments().stream()
            .map(d -> new RankedDocument(d.getText(), d.getMetadata()))
            .toList();
        return new TicketDiagnostics(
            resolution.response(),
            resolution.rewrittenQueries(),
            docs,
            resolution.retrievalQuality(),
            resolution.actionDecision(),
            resolution.safetyOverrideApplied());
    }
}
