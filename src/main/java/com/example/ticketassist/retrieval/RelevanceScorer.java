package com.example.ticketassist.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairwise (query, passage) relevance model. Higher is more relevant; scores have no fixed range.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String query, String text);

    /** Scores every text against {@code query}; the result is index-aligned with {@code texts}. */
    default List<Double> scoreAll(String query, List<String> texts) {
        List<Double> scores = new ArrayList<>(texts.size());
        for (String text : texts) {
            scores.add(score(query, text));
        }
        return scores;
    }
}
