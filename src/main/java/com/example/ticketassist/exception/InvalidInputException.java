package com.example.ticketassist.exception;

public class InvalidInputException extends TicketResolutionException {

    public InvalidInputException(String message) {
        super(message);
    }

    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(name + " must be non-empty");
        }
        return value.strip();
    }
}
