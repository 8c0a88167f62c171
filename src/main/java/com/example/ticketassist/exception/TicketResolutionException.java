package com.example.ticketassist.exception;

/**
 * Base type for failures raised by the resolution pipeline itself. Collaborator failures
 * (vector index, reranker, embedding, generation) are not wrapped in this type.
 */
public abstract class TicketResolutionException extends RuntimeException {

    protected TicketResolutionException(String message) {
        super(message);
    }

    protected TicketResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
