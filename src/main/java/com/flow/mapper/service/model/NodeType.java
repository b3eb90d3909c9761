package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a process graph node. Governs the degree rules a node must satisfy.
 */
public enum NodeType {
    START,
    PROCESS,
    DECISION,
    MERGE,
    END;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return PROCESS;
        }
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == START || this == END;
    }
}
