package com.example.ticketassist.pipeline;

import com.example.ticketassist.model.ActionRequired;

/**
 * Classifier output. {@code action} is an {@link ActionRequired} value or {@link #NO_ACTION}
 * when the classifier abstained; {@code confidence} is the best similarity, rounded to three
 * decimals.
 */
public record ActionDecision(String action, double confidence) {

    public static final String NO_ACTION = "no_action";

    public static ActionDecision abstain(double confidence) {
        return new ActionDecision(NO_ACTION, confidence);
    }

    public boolean abstained() {
        return NO_ACTION.equals(action);
    }

    /** The external label for this decision; abstention maps to {@code none}. */
    public String externalLabel() {
        return abstained() ? ActionRequired.NONE.value() : action;
    }
}
