package com.flow.mapper.service.translate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic tag of an intent step, as produced by the language-understanding side.
 */
public enum IntentStepType {
    STEP,
    DECISION,
    START_POINT,
    END_POINT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntentStepType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return STEP;
        }
        return IntentStepType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
