package com.example.ticketassist.model;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/** Follow-up action attached to every resolved ticket. Closed set; the wire value is lower snake case. */
public enum ActionRequired {
    NONE("none"),
    CUSTOMER_ACTION_REQUIRED("customer_action_required"),
    FOLLOW_UP_REQUIRED("follow_up_required"),
    ESCALATE_TO_SUPPORT("escalate_to_support"),
    ESCALATE_TO_ABUSE_TEAM("escalate_to_abuse_team"),
    ESCALATE_TO_BILLING("escalate_to_billing"),
    ESCALATE_TO_TECHNICAL("escalate_to_technical");

    private final String value;

    ActionRequired(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ActionRequired> fromValue(String value) {
        return Arrays.stream(values())
            .filter(a -> a.value.equals(value))
            .findFirst();
    }
}
