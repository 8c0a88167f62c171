package com.example.ticketassist.llm;

public record LlmResponse(
    String content,
    String model,
    String provider,
    int inputTokens,
    int outputTokens,
    String finishReason
) {}
