package com.example.ticketassist.llm;

/**
 * Text-in, text-out generation backend.
 *
 * <p>Implementations own their transport concerns (timeouts, retries, provider fallback).
 * Callers treat any exception as fatal for the current ticket.
 */
@FunctionalInterface
public interface GenerationClient {

    String complete(String prompt);
}
