package com.example.ticketassist.exception;

import java.util.List;

public class ResponseValidationException extends TicketResolutionException {

    private final List<String> violations;

    public ResponseValidationException(List<String> violations) {
        super("Response validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
