package com.example.ticketassist.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.ticketassist.exception.ResponseValidationException;
import com.example.ticketassist.model.ActionRequired;
import com.example.ticketassist.model.DraftResponse;
import com.example.ticketassist.model.TicketResponse;

/**
 * Last gate before a response leaves the pipeline. All violations are collected and reported
 * together; nothing is truncated or repaired.
 */
@Component
public class ResponseValidator {

    public static final int MAX_ANSWER_LENGTH = 5000;
    public static final int MAX_REFERENCES = 3;

    public TicketResponse validate(DraftResponse draft) {
        List<String> violations = new ArrayList<>();

        String answer = draft.answer() != null ? draft.answer().strip() : "";
        if (answer.isEmpty()) {
            violations.add("answer must be non-empty");
        } else if (answer.length() > MAX_ANSWER_LENGTH) {
            violations.add("answer exceeds " + MAX_ANSWER_LENGTH + " characters");
        }

        List<String> references = new ArrayList<>();
        if (draft.references() != null) {
            for (String ref : draft.references()) {
                if (ref != null && !ref.isBlank()) {
                    references.add(ref.strip());
                }
            }
        }
        if (references.size() > MAX_REFERENCES) {
            violations.add("at most " + MAX_REFERENCES + " references allowed, got " + references.size());
        }

        Optional<ActionRequired> action = ActionRequired.fromValue(draft.actionRequired());
        if (action.isEmpty()) {
            violations.add("action_required '" + draft.actionRequired() + "' is not a recognized action");
        }

        if (!violations.isEmpty()) {
            throw new ResponseValidationException(violations);
        }
        return new TicketResponse(answer, references, action.get());
    }
}
