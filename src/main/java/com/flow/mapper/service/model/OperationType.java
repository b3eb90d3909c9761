package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Wire names of the patch operation kinds.
 */
public enum OperationType {
    ADD_NODE,
    UPDATE_NODE,
    DELETE_NODE,
    ADD_EDGE,
    UPDATE_EDGE,
    DELETE_EDGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
