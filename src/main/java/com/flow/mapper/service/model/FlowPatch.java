package com.flow.mapper.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Ordered list of operations; the only unit of change to a {@link ProcessFlow}.
 *
 * @param operations operations, applied in order
 * @param source     provenance tag, e.g. {@code api} or {@code intent_translator}
 * @param createdAt  when the patch was built
 * @param appliedAt  when the patch engine applied it, {@code null} until then
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowPatch(
        List<PatchOperation> operations,
        String source,
        Instant createdAt,
        Instant appliedAt
) {

    public static final String SOURCE_API = "api";

    public FlowPatch {
        operations = operations == null ? List.of() : List.copyOf(operations);
        source = source == null || source.isBlank() ? SOURCE_API : source;
    }

    public static FlowPatch of(String source, Instant createdAt, List<PatchOperation> operations) {
        return new FlowPatch(operations, source, createdAt, null);
    }

    public FlowPatch withAppliedAt(Instant timestamp) {
        return new FlowPatch(operations, source, createdAt, timestamp);
    }

    public int size() {
        return operations.size();
    }
}
