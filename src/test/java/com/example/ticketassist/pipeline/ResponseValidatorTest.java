package com.example.ticketassist.pipeline;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.ticketassist.exception.ResponseValidationException;
import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.model.DraftResponse;
import com.example.ticketassist.model.TicketResponse;

import static org.junit.jupiter.api.Assertions.*;

class ResponseValidatorTest {

    private final ResponseValidator validator = new ResponseValidator();

    @Test
    void acceptsWellFormedDraft() {
        TicketResponse response = validator.validate(new DraftResponse(
            "  Verify your WHOIS email.  ",
            List.of(" faqs: Whois | file=faqs/whois.md "),
            "customer_action_required"));

        assertEquals("Verify your WHOIS email.", response.answer());
        assertEquals(List.of("faqs: Whois | file=faqs/whois.md"), response.references());
        assertEquals(ActionRequired.CUSTOMER_ACTION_REQUIRED, response.actionRequired());
    }

    @Test
    void rejectsMoreThanThreeReferences() {
        var draft = new DraftResponse("answer", List.of("r1", "r2", "r3", "r4"), "none");

        var e = assertThrows(ResponseValidationException.class, () -> validator.validate(draft));
        assertEquals(1, e.violations().size());
    }

    @Test
    void blankReferencesAreDroppedBeforeCounting() {
        var draft = new DraftResponse("answer", Arrays.asList("r1", " ", null, "r2", "r3"), "none");

        assertEquals(List.of("r1", "r2", "r3"), validator.validate(draft).references());
    }

    @ParameterizedTest
    @ValueSource(strings = {"no_action", "NONE", "escalate", ""})
    void rejectsUnknownAction(String action) {
        var draft = new DraftResponse("answer", List.of(), action);

        assertThrows(ResponseValidationException.class, () -> validator.validate(draft));
    }

    @Test
    void rejectsBlankAnswer() {
        assertThrows(ResponseValidationException.class,
            () -> validator.validate(new DraftResponse("   ", List.of(), "none")));
        assertThrows(ResponseValidationException.class,
            () -> validator.validate(new DraftResponse(null, List.of(), "none")));
    }

    @Test
    void answerLengthLimitAppliesAfterStripping() {
        String max = "a".repeat(5000);

        assertEquals(max, validator.validate(new DraftResponse("  " + max + "  ", List.of(), "none")).answer());
        assertThrows(ResponseValidationException.class,
            () -> validator.validate(new DraftResponse(max + "a", List.of(), "none")));
    }

    @Test
    void reportsEveryViolation() {
        var draft = new DraftResponse("", List.of("r1", "r2", "r3", "r4"), "maybe");

        var e = assertThrows(ResponseValidationException.class, () -> validator.validate(draft));
        assertEquals(3, e.violations().size());
    }
}
