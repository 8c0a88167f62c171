package com.example.ticketassist.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.retrieval.QualityAssessment;
import com.example.ticketassist.retrieval.RetrievalQuality;

/**
 * Keeps a weakly grounded answer from closing the ticket: when aggregate retrieval quality is
 * {@code poor} and no action was inferred, a human follow-up is requested instead. The answer
 * text itself is never withheld.
 */
@Component
public class SafetyOverride {

    private static final Logger log = LoggerFactory.getLogger(SafetyOverride.class);

    public ActionRequired apply(QualityAssessment aggregate, ActionRequired action) {
        if (aggregate.is(RetrievalQuality.POOR) && action == ActionRequired.NONE) {
            log.warn("Poor retrieval quality (reason={}), forcing {}",
                aggregate.reason() != null ? aggregate.reason() : "low_scores",
                ActionRequired.FOLLOW_UP_REQUIRED.value());
            return ActionRequired.FOLLOW_UP_REQUIRED;
        }
        return action;
    }
}
