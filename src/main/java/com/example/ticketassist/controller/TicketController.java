package com.example.ticketassist.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.ticketassist.model.TicketResponse;
import com.example.ticketassist.pipeline.TicketPipeline;
import com.example.ticketassist.pipeline.TicketResolution;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class TicketController {

    private static final Logger log = LoggerFactory.getLogger(TicketController.class);

    static final int MIN_TICKET_LENGTH = 5;
    static final int MAX_TICKET_LENGTH = 5000;
    static final String FAILURE_DETAIL = "Failed to resolve support ticket";

    private final TicketPipeline pipeline;

    public TicketController(TicketPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public record TicketRequest(@JsonProperty("ticket_text") String ticketText) {}

    @PostMapping("/resolve-ticket")
    public Mono<TicketResponse> resolve(@RequestBody TicketRequest request) {
        return resolveInternal(request).map(TicketResolution::response);
    }

    Mono<TicketResolution> resolveInternal(TicketRequest request) {
        String error = checkRequest(request);
        if (error != null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, error));
        }

        log.info("Received ticket (length={})", request.ticketText().length());
        return Mono.fromCallable(() -> pipeline.resolve(request.ticketText()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(r -> log.info("Ticket resolved (answer_length={}, references={}, action={})",
                r.response().answer().length(), r.response().references().size(),
                r.response().actionRequired().value()))
            .onErrorMap(e -> !(e instanceof ResponseStatusException), e -> {
                log.error("Ticket resolution failed", e);
                return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, FAILURE_DETAIL);
            });
    }

    static String checkRequest(TicketRequest request) {
        if (request == null || request.ticketText() == null) {
            return "ticket_text is required";
        }
        int length = request.ticketText().length();
        if (length < MIN_TICKET_LENGTH || length > MAX_TICKET_LENGTH) {
            return "ticket_text must be between " + MIN_TICKET_LENGTH + " and " + MAX_TICKET_LENGTH + " characters";
        }
        if (request.ticketText().isBlank()) {
            return "ticket_text cannot be blank";
        }
        return null;
    }
}
