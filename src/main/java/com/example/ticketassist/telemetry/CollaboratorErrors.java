package com.example.ticketassist.telemetry;

import java.util.Locale;

import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps collaborator failures onto the {@code error.type} values recorded on spans and counters.
 * Classification is for telemetry only; the original exception is always rethrown unchanged.
 */
public final class CollaboratorErrors {

    private CollaboratorErrors() {
    }

    public static String classify(Throwable e) {
        if (e == null) return "unknown_error";
        if (e instanceof WebClientResponseException http) {
            return classifyStatus(http.getStatusCode().value());
        }
        String msg = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        if (msg.contains("rate limit") || msg.contains("429")) return "rate_limit";
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("deadline")) return "timeout";
        if (msg.contains("401") || msg.contains("403") || msg.contains("auth") || msg.contains("api key")) return "auth_error";
        if (msg.contains("400") || msg.contains("422") || msg.contains("invalid")) return "invalid_request";
        if (msg.contains("500") || msg.contains("502") || msg.contains("503") || msg.contains("server")) return "server_error";
        if (msg.contains("connect") || msg.contains("dns") || msg.contains("network") || msg.contains("reset")) return "network_error";
        return "unknown_error";
    }

    static String classifyStatus(int status) {
        if (status == 429) return "rate_limit";
        if (status == 408 || status == 504) return "timeout";
        if (status == 401 || status == 403) return "auth_error";
        if (status >= 400 && status < 500) return "invalid_request";
        if (status >= 500) return "server_error";
        return "unknown_error";
    }
}
