package com.example.ticketassist.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** External response contract. Only built by the response validator. */
public record TicketResponse(
    String answer,
    List<String> references,
    @JsonProperty("action_required") ActionRequired actionRequired
) {

    public TicketResponse {
        references = List.copyOf(references);
    }
}
