package com.example.ticketassist.model;

import java.util.List;

/**
 * Unvalidated response fields as assembled by the pipeline. The action is carried as its raw
 * label so that a label outside the closed set is caught by validation rather than by the type.
 */
public record DraftResponse(String answer, List<String> references, String actionRequired) {}
