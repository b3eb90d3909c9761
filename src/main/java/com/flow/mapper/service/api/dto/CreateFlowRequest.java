package com.flow.mapper.service.api.dto;

import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to create a flow, empty or seeded from an existing snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateFlowRequest {

    @Size(max = 200, message = "name must be at most 200 characters")
    private String name;

    @Builder.Default
    private List<ProcessNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<ProcessEdge> edges = new ArrayList<>();

    public ProcessFlow toFlow() {
        return ProcessFlow.of(nodes, edges);
    }
}
