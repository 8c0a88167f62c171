package com.example.ticketassist.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrievalQuality {
    GOOD("good"),
    PARTIALLY_GOOD("partially_good"),
    POOR("poor");

    private final String label;

    RetrievalQuality(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
