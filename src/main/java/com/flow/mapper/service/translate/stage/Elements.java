package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;

/**
 * Factories for the nodes and edges the pipeline synthesizes.
 */
final class Elements {

    private Elements() {
    }

    static ProcessNode node(String id, NodeType type, String label) {
        return ProcessNode.builder()
                .id(id)
                .type(type)
                .label(label)
                .build();
    }

    static ProcessEdge edge(String id, String source, String target) {
        return edge(id, source, target, null);
    }

    static ProcessEdge edge(String id, String source, String target, String condition) {
        return ProcessEdge.builder()
                .id(id)
                .source(source)
                .target(target)
                .condition(condition)
                .build();
    }
}
