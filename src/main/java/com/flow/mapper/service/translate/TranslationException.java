package com.flow.mapper.service.translate;

import com.flow.mapper.service.topology.TopologyViolation;

import java.util.List;

/**
 * The intent cannot be turned into a usable graph.
 */
public class TranslationException extends RuntimeException {

    public static final String USER_MESSAGE =
            "We could not understand this as a business process. Please describe the process again, "
                    + "step by step, including what happens after each step.";

    private final Reason reason;
    private final List<TopologyViolation> violations;

    public TranslationException(Reason reason, String message) {
        this(reason, message, List.of());
    }

    public TranslationException(Reason reason, String message, List<TopologyViolation> violations) {
        super(message);
        this.reason = reason;
        this.violations = List.copyOf(violations);
    }

    public Reason getReason() {
        return reason;
    }

    public List<TopologyViolation> getViolations() {
        return violations;
    }

    public String getUserMessage() {
        return USER_MESSAGE;
    }

    public String getErrorCode() {
        return "INTENT_REJECTED";
    }

    public enum Reason {
        NO_STEPS,
        NO_FLOWS,
        NO_MEANINGFUL_STEPS,
        UNREPAIRABLE
    }
}
