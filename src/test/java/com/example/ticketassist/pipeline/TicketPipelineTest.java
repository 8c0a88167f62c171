package com.example.ticketassist.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;

import com.example.ticketassist.config.ActionProperties;
import com.example.ticketassist.config.RetrievalProperties;
import com.example.ticketassist.embedding.EmbeddingClient;
import com.example.ticketassist.exception.GenerationFormatException;
import com.example.ticketassist.exception.InvalidInputException;
import com.example.ticketassist.llm.GenerationClient;
import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.retrieval.CrossQueryAggregator;
import com.example.ticketassist.retrieval.DocumentIndex;
import com.example.ticketassist.retrieval.HybridRetriever;
import com.example.ticketassist.retrieval.QualityEvaluator;
import com.example.ticketassist.retrieval.Reranker;
import com.example.ticketassist.retrieval.RelevanceScorer;
import com.example.ticketassist.retrieval.RetrievalQuality;
import com.example.ticketassist.telemetry.TicketMetrics;

import static org.junit.jupiter.api.Assertions.*;

class TicketPipelineTest {

    private static final String REFUND_ANSWER = "Your refund has been issued to the original card.";
    private static final String STATUS_ANSWER = "Your domain is active and resolving normally.";

    private static final Map<String, float[]> VECTORS = Map.of(
        "refund the charge", new float[] {1f, 0f, 0f},
        "no further action needed", new float[] {0f, 1f, 0f},
        REFUND_ANSWER, new float[] {0.9f, 0.1f, 0f});

    private static final List<Document> KNOWLEDGE_BASE = List.of(
        doc("Refunds are issued to the original payment method.", "billing", "Refunds", "billing/refunds.md"),
        doc("Domain status can be checked in the dashboard.", "faqs", "Domain Status", "faqs/status.md"),
        doc("Suspended domains require WHOIS verification.", "policies", "Suspension", "policies/suspension.md"),
        doc("DNS changes propagate within 48 hours.", "runbooks", "DNS", "runbooks/dns.md"));

    private final List<String> searchedQueries = Collections.synchronizedList(new ArrayList<>());

    private static Document doc(String text, String category, String section, String sourceFile) {
        return new Document(text, Map.of("category", category, "section", section, "source_file", sourceFile));
    }

    private TicketPipeline pipeline(String rewriteOutput, String answerOutput, Map<String, Double> scores,
                                    List<Document> corpus) {
        RetrievalProperties props = RetrievalProperties.defaults();

        GenerationClient generation = prompt -> prompt.contains("Queries:") ? rewriteOutput : answerOutput;
        DocumentIndex index = (query, k) -> {
            searchedQueries.add(query);
            return corpus.subList(0, Math.min(k, corpus.size()));
        };
        RelevanceScorer scorer = (query, text) -> scores.getOrDefault(text, 0.0);
        EmbeddingClient embeddings = text -> VECTORS.getOrDefault(text, new float[] {0f, 0f, 1f});

        Map<ActionRequired, List<String>> prototypes = new LinkedHashMap<>();
        prototypes.put(ActionRequired.ESCALATE_TO_BILLING, List.of("refund the charge"));
        prototypes.put(ActionRequired.NONE, List.of("no further action needed"));

        return new TicketPipeline(
            new QueryRewriter(generation, props),
            new CrossQueryAggregator(new HybridRetriever(index, props), new Reranker(scorer, props),
                new QualityEvaluator(props), props),
            new AnswerGenerator(generation),
            new ReferenceSelector(),
            new ActionClassifier(embeddings, ActionPrototypeIndex.embed(embeddings, prototypes),
                new ActionProperties(0.5)),
            new SafetyOverride(),
            new ResponseValidator(),
            new TicketMetrics(),
            props);
    }

    private static String answerJson(String answer) {
        return "{\"answer\": \"" + answer + "\"}";
    }

    private static Map<String, Double> uniformScores(double score) {
        Map<String, Double> scores = new LinkedHashMap<>();
        KNOWLEDGE_BASE.forEach(d -> scores.put(d.getText(), score));
        return scores;
    }

    @Test
    void poorRetrievalWithoutActionForcesFollowUp() {
        var pipeline = pipeline("domain status\nrefund policy", answerJson(STATUS_ANSWER),
            uniformScores(1.0), KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("Is my domain ok?");

        assertEquals(RetrievalQuality.POOR, resolution.retrievalQuality().quality());
        assertEquals("no_action", resolution.actionDecision().action());
        assertEquals(ActionRequired.FOLLOW_UP_REQUIRED, resolution.response().actionRequired());
        assertTrue(resolution.safetyOverrideApplied());
        assertEquals(STATUS_ANSWER, resolution.response().answer());
    }

    @Test
    void partiallyGoodQueriesStillForceFollowUpByDefault() {
        var pipeline = pipeline("domain status\nrefund policy", answerJson(STATUS_ANSWER),
            uniformScores(3.5), KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("Is my domain ok?");

        assertEquals(RetrievalQuality.POOR, resolution.retrievalQuality().quality());
        assertEquals("no_relevant_retrieval", resolution.retrievalQuality().reason());
        assertEquals(ActionRequired.FOLLOW_UP_REQUIRED, resolution.response().actionRequired());
        assertTrue(resolution.safetyOverrideApplied());
    }

    @Test
    void goodRetrievalKeepsNone() {
        Map<String, Double> scores = uniformScores(0.5);
        scores.put("Domain status can be checked in the dashboard.", 4.8);
        scores.put("Suspended domains require WHOIS verification.", 3.9);
        var pipeline = pipeline("domain status", answerJson(STATUS_ANSWER), scores, KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("Is my domain ok?");

        assertEquals(RetrievalQuality.GOOD, resolution.retrievalQuality().quality());
        assertEquals(ActionRequired.NONE, resolution.response().actionRequired());
        assertFalse(resolution.safetyOverrideApplied());
        assertEquals(List.of(
                "faqs: Domain Status | file=faqs/status.md",
                "policies: Suspension | file=policies/suspension.md",
                "billing: Refunds | file=billing/refunds.md"),
            resolution.response().references());
    }

    @Test
    void inferredActionSurvivesPoorRetrieval() {
        var pipeline = pipeline("refund", answerJson(REFUND_ANSWER), uniformScores(1.0), KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("Please refund my last invoice");

        assertEquals(ActionRequired.ESCALATE_TO_BILLING, resolution.response().actionRequired());
        assertFalse(resolution.safetyOverrideApplied());
    }

    @Test
    void emptyRewriteFallsBackToTicketText() {
        var pipeline = pipeline("\n  \n", answerJson(STATUS_ANSWER), uniformScores(1.0), KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("  Where is my refund?  ");

        assertEquals(List.of("Where is my refund?"), resolution.rewrittenQueries());
        assertEquals(List.of("Where is my refund?"), searchedQueries);
    }

    @Test
    void emptyIndexStillAnswersButRequestsFollowUp() {
        var pipeline = pipeline("refund", answerJson("I don't know."), Map.of(), List.of());

        TicketResolution resolution = pipeline.resolve("Where is my refund?");

        assertTrue(resolution.finalDocuments().isEmpty());
        assertTrue(resolution.response().references().isEmpty());
        assertEquals("no_relevant_retrieval", resolution.retrievalQuality().reason());
        assertEquals(ActionRequired.FOLLOW_UP_REQUIRED, resolution.response().actionRequired());
    }

    @Test
    void referencesFollowFinalRankingAndAreCapped() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("Refunds are issued to the original payment method.", 1.0);
        scores.put("Domain status can be checked in the dashboard.", 2.0);
        scores.put("Suspended domains require WHOIS verification.", 3.0);
        scores.put("DNS changes propagate within 48 hours.", 4.0);
        var pipeline = pipeline("dns", answerJson(STATUS_ANSWER), scores, KNOWLEDGE_BASE);

        TicketResolution resolution = pipeline.resolve("DNS not updating");

        assertEquals(4, resolution.finalDocuments().size());
        assertEquals(3, resolution.response().references().size());
        assertEquals("runbooks: DNS | file=runbooks/dns.md", resolution.response().references().get(0));
    }

    @Test
    void malformedGenerationAbortsResolution() {
        var pipeline = pipeline("refund", "Sure, here you go!", uniformScores(1.0), KNOWLEDGE_BASE);

        var e = assertThrows(GenerationFormatException.class, () -> pipeline.resolve("Where is my refund?"));
        assertEquals(GenerationFormatException.Reason.MALFORMED_JSON, e.reason());
    }

    @Test
    void collaboratorFailurePropagatesUnchanged() {
        RuntimeException outage = new IllegalStateException("503 service unavailable");
        RetrievalProperties props = RetrievalProperties.defaults();
        GenerationClient failing = prompt -> {
            throw outage;
        };
        EmbeddingClient embeddings = text -> new float[] {1f, 0f, 0f};
        var pipeline = new TicketPipeline(
            new QueryRewriter(failing, props),
            new CrossQueryAggregator(new HybridRetriever((q, k) -> List.of(), props),
                new Reranker((q, t) -> 0.0, props), new QualityEvaluator(props), props),
            new AnswerGenerator(failing),
            new ReferenceSelector(),
            new ActionClassifier(embeddings,
                ActionPrototypeIndex.embed(embeddings, Map.of(ActionRequired.NONE, List.of("none"))),
                new ActionProperties(0.5)),
            new SafetyOverride(),
            new ResponseValidator(),
            new TicketMetrics(),
            props);

        var e = assertThrows(IllegalStateException.class, () -> pipeline.resolve("Where is my refund?"));
        assertSame(outage, e);
    }

    @Test
    void blankTicketIsRejected() {
        var pipeline = pipeline("refund", answerJson(STATUS_ANSWER), uniformScores(1.0), KNOWLEDGE_BASE);

        assertThrows(InvalidInputException.class, () -> pipeline.resolve("   "));
        assertTrue(searchedQueries.isEmpty());
    }
}
