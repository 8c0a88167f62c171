package com.example.ticketassist.exception;

/** The generation backend did not honor the strict JSON answer contract. */
public class GenerationFormatException extends TicketResolutionException {

    public enum Reason {
        /** Output could not be parsed as a single JSON document. */
        MALFORMED_JSON,
        /** Output parsed, but the answer field is absent or not a string. */
        MISSING_ANSWER
    }

    private final Reason reason;

    public GenerationFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
