package com.example.ticketassist.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ticketassist.embedding.EmbeddingClient;
import com.example.ticketassist.embedding.Vectors;
import com.example.ticketassist.model.ActionRequired;

/**
 * Normalized embeddings of every action's exemplar phrases, computed once and never modified,
 * so one instance can be shared by concurrent resolutions.
 */
public final class ActionPrototypeIndex {

    private static final Logger log = LoggerFactory.getLogger(ActionPrototypeIndex.class);

    private final Map<ActionRequired, List<float[]>> vectors;

    private ActionPrototypeIndex(Map<ActionRequired, List<float[]>> vectors) {
        this.vectors = vectors;
    }

    public static ActionPrototypeIndex embed(EmbeddingClient embeddingClient,
                                             Map<ActionRequired, List<String>> prototypes) {
        long start = System.nanoTime();
        Map<ActionRequired, List<float[]>> vectors = new LinkedHashMap<>();
        int count = 0;
        for (var entry : prototypes.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("No exemplar phrases for action " + entry.getKey().value());
            }
            List<float[]> embedded = new ArrayList<>(entry.getValue().size());
            for (String phrase : entry.getValue()) {
                embedded.add(Vectors.normalize(embeddingClient.embed(phrase)));
                count++;
            }
            vectors.put(entry.getKey(), Collections.unmodifiableList(embedded));
        }
        log.info("Embedded {} action prototypes for {} actions in {}ms",
            count, vectors.size(), (System.nanoTime() - start) / 1_000_000);
        return new ActionPrototypeIndex(Collections.unmodifiableMap(vectors));
    }

    /** Actions in prototype order. */
    public Set<ActionRequired> actions() {
        return vectors.keySet();
    }

    /** Highest cosine similarity between {@code query} and any exemplar of {@code action}. */
    public double maxSimilarity(ActionRequired action, float[] query) {
        double max = Double.NEGATIVE_INFINITY;
        for (float[] prototype : vectors.getOrDefault(action, List.of())) {
            max = Math.max(max, Vectors.dot(prototype, query));
        }
        return max;
    }
}
