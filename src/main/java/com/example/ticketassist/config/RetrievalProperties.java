package com.example.ticketassist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retrieval fan-out sizes and the reranker score thresholds used to grade retrieval quality.
 *
 * <p>The 3.0 / 4.0 thresholds are calibrated against the ms-marco MiniLM cross-encoder family
 * and have to be revisited if the reranking model changes.
 */
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalProperties(
    @DefaultValue("6") int initialK,
    @DefaultValue("4") int rerankTopK,
    @DefaultValue("4") int finalK,
    @DefaultValue("5") int maxQueries,
    @DefaultValue("3") int referenceCount,
    @DefaultValue("4.0") double goodTopScore,
    @DefaultValue("0.6") double goodScoreGap,
    @DefaultValue("3.0") double partialTopScore,
    @DefaultValue("true") boolean parallelQueries,
    @DefaultValue("false") boolean partialQualityUpgrades
) {

    public static RetrievalProperties defaults() {
        return new RetrievalProperties(6, 4, 4, 5, 3, 4.0, 0.6, 3.0, true, false);
    }
}
