package com.flow.mapper.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.mapper.service.topology.TopologyViolation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * DTO for one topology violation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViolationResponse {

    /**
     * "degree" or "dangling_edge".
     */
    private String kind;

    /**
     * Offending node id, or edge id for dangling edges.
     */
    private String elementId;

    private String nodeType;

    /**
     * "incoming" or "outgoing".
     */
    private String direction;

    /**
     * Allowed degree, e.g. "exactly 1" or "at least 2".
     */
    private String expected;

    private Long actual;

    private String message;

    public static ViolationResponse from(TopologyViolation violation) {
        return ViolationResponse.builder()
                .kind(violation.kind().name().toLowerCase(Locale.ROOT))
                .elementId(violation.elementId())
                .nodeType(violation.nodeType() != null ? violation.nodeType().wireName() : null)
                .direction(violation.direction().name().toLowerCase(Locale.ROOT))
                .expected(violation.expected() != null ? violation.expected().describe() : null)
                .actual(violation.kind() == TopologyViolation.Kind.DEGREE ? violation.actual() : null)
                .message(violation.message())
                .build();
    }

    public static List<ViolationResponse> fromAll(List<TopologyViolation> violations) {
        return violations.stream().map(ViolationResponse::from).toList();
    }
}
