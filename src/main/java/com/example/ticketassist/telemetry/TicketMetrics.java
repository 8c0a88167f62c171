package com.example.ticketassist.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class TicketMetrics {

    private final DoubleHistogram resolutionDuration;
    private final LongCounter resolutionCount;
    private final LongCounter retrievalQuality;
    private final DoubleHistogram topRelevance;
    private final LongCounter actionCount;
    private final LongCounter safetyOverrides;

    public TicketMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("ticket-assist");

        this.resolutionDuration = meter.histogramBuilder("ticket.resolution.duration")
            .setUnit("s")
            .setDescription("Duration of ticket resolutions")
            .build();

        this.resolutionCount = meter.counterBuilder("ticket.resolution.count")
            .setDescription("Ticket resolutions by outcome")
            .build();

        this.retrievalQuality = meter.counterBuilder("ticket.retrieval.quality")
            .setDescription("Aggregate retrieval quality verdicts")
            .build();

        this.topRelevance = meter.histogramBuilder("ticket.retrieval.top_relevance")
            .setDescription("Top reranker score of the final documents")
            .build();

        this.actionCount = meter.counterBuilder("ticket.action.count")
            .setDescription("Follow-up actions attached to responses")
            .build();

        this.safetyOverrides = meter.counterBuilder("ticket.safety_override.count")
            .setDescription("Responses forced to follow-up because retrieval was poor")
            .build();
    }

    public void recordResolution(double seconds, String outcome) {
        Attributes attrs = Attributes.of(AttributeKey.stringKey("ticket.outcome"), outcome);
        resolutionDuration.record(seconds, attrs);
        resolutionCount.add(1, attrs);
    }

    public void recordRetrievalQuality(String quality, int queries) {
        retrievalQuality.add(1, Attributes.of(
            AttributeKey.stringKey("ticket.retrieval_quality"), quality,
            AttributeKey.longKey("ticket.queries"), (long) queries
        ));
    }

    public void recordTopRelevance(double score) {
        topRelevance.record(score);
    }

    public void recordAction(String action, boolean overridden) {
        actionCount.add(1, Attributes.of(
            AttributeKey.stringKey("ticket.action"), action,
            AttributeKey.booleanKey("ticket.safety_override"), overridden
        ));
        if (overridden) {
            safetyOverrides.add(1);
        }
    }
}
