package com.example.ticketassist.retrieval;

/** Outcome of the retrieve, rerank and evaluate steps for one rewritten query. */
public record QueryRetrieval(String query, RetrievalResult result, QualityAssessment assessment) {}
