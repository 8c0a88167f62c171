package com.example.ticketassist.pipeline;

import java.util.List;

import org.springframework.ai.document.Document;

import com.example.ticketassist.model.TicketResponse;
import com.example.ticketassist.retrieval.QualityAssessment;

/**
 * Validated response plus the diagnostics gathered on the way. Only {@link #response()} may
 * cross the external boundary.
 */
public record TicketResolution(
    TicketResponse response,
    List<String> rewrittenQueries,
    List<Document> finalDocuments,
    QualityAssessment retrievalQuality,
    ActionDecision actionDecision,
    boolean safetyOverrideApplied
) {}
