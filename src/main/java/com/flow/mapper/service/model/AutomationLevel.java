package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a step is performed by a person or a system.
 */
public enum AutomationLevel {
    MANUAL,
    AUTOMATED,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps free text ("manual", "Automated", ...) to a level. Blank or
     * unrecognised text is {@link #UNKNOWN}.
     */
    @JsonCreator
    public static AutomationLevel fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "manual" -> MANUAL;
            case "automated" -> AUTOMATED;
            default -> UNKNOWN;
        };
    }
}
