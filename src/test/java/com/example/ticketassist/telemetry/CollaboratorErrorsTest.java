package com.example.ticketassist.telemetry;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import static org.junit.jupiter.api.Assertions.*;

class CollaboratorErrorsTest {

    @ParameterizedTest
    @CsvSource({
        "'rate limit exceeded',          rate_limit",
        "'status 429: too many requests', rate_limit",
        "'context deadline exceeded: timeout', timeout",
        "'request timed out',            timeout",
        "'401 unauthorized',             auth_error",
        "'authentication failed',        auth_error",
        "'invalid api key',              auth_error",
        "'422 unprocessable entity',     invalid_request",
        "'invalid model name',           invalid_request",
        "'502 bad gateway',              server_error",
        "'connection refused',           network_error",
        "'connection reset by peer',     network_error",
        "'something unexpected',         unknown_error",
    })
    void classifiesByMessage(String message, String expected) {
        assertEquals(expected, CollaboratorErrors.classify(new RuntimeException(message)),
            "classify(\"" + message + "\") should be " + expected);
    }

    @ParameterizedTest
    @CsvSource({
        "429, rate_limit",
        "408, timeout",
        "504, timeout",
        "401, auth_error",
        "403, auth_error",
        "400, invalid_request",
        "413, invalid_request",
        "500, server_error",
        "503, server_error",
    })
    void classifiesRerankerHttpStatus(int status, String expected) {
        var e = WebClientResponseException.create(HttpStatusCode.valueOf(status), "status " + status,
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8, null);

        assertEquals(expected, CollaboratorErrors.classify(e));
    }

    @Test
    void classifiesNullAndMessageless() {
        assertEquals("unknown_error", CollaboratorErrors.classify(null));
        assertEquals("unknown_error", CollaboratorErrors.classify(new IllegalStateException()));
    }
}
