package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.mapper.service.patch.PatchHistory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One undoable patch of a flow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryEntryResponse {

    private String source;

    private int operationCount;

    private Instant createdAt;

    private Instant appliedAt;

    /**
     * Node count of the snapshot a rollback returns to.
     */
    private int nodeCountBefore;

    public static HistoryEntryResponse from(PatchHistory.HistoryEntry entry) {
        return HistoryEntryResponse.builder()
                .source(entry.patch().source())
                .operationCount(entry.patch().size())
                .createdAt(entry.patch().createdAt())
                .appliedAt(entry.patch().appliedAt())
                .nodeCountBefore(entry.before().nodes().size())
                .build();
    }
}
