package com.example.ticketassist.retrieval;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Score statistics behind a retrieval-quality verdict. Numeric fields are rounded to three
 * decimals; {@code reason} is only set when the verdict was not derived from scores.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityAssessment(
    RetrievalQuality quality,
    @JsonProperty("avg_score") double avgScore,
    @JsonProperty("top_score") double topScore,
    @JsonProperty("score_gap") double scoreGap,
    @JsonProperty("num_results") int numResults,
    @JsonProperty("categories_covered") List<String> categoriesCovered,
    String reason
) {

    public static final String NO_DOCUMENTS_RETRIEVED = "no_documents_retrieved";
    public static final String NO_RELEVANT_RETRIEVAL = "no_relevant_retrieval";

    public QualityAssessment {
        categoriesCovered = List.copyOf(categoriesCovered);
    }

    public static QualityAssessment poor(String reason) {
        return new QualityAssessment(RetrievalQuality.POOR, 0.0, 0.0, 0.0, 0, List.of(), reason);
    }

    public boolean is(RetrievalQuality other) {
        return quality == other;
    }
}
