package com.example.ticketassist.model;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class ActionRequiredTest {

    @ParameterizedTest
    @EnumSource(ActionRequired.class)
    void valueRoundTripsThroughLookup(ActionRequired action) {
        assertEquals(action, ActionRequired.fromValue(action.value()).orElseThrow());
    }

    @Test
    void lookupIsExactMatchOnly() {
        assertTrue(ActionRequired.fromValue("no_action").isEmpty());
        assertTrue(ActionRequired.fromValue("NONE").isEmpty());
        assertTrue(ActionRequired.fromValue(null).isEmpty());
    }

    @Test
    void responseSerializesWithSnakeCaseAction() throws Exception {
        var response = new TicketResponse("Done.", List.of("faqs: Billing | file=faqs/billing.md"),
            ActionRequired.ESCALATE_TO_BILLING);

        String json = new ObjectMapper().writeValueAsString(response);

        assertEquals("{\"answer\":\"Done.\",\"references\":[\"faqs: Billing | file=faqs/billing.md\"],"
            + "\"action_required\":\"escalate_to_billing\"}", json);
    }

    @Test
    void roundingIsHalfEvenToThreeDecimals() {
        assertEquals(0.124, Scores.round3(0.1235));
        assertEquals(0.126, Scores.round3(0.1255));
        assertEquals(4.35, Scores.round3(4.35));
        assertEquals(-1.0, Scores.round3(-0.99951));
    }
}
