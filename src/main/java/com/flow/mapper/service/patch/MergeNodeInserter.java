package com.flow.mapper.service.patch;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;

import java.time.Instant;
import java.util.List;

/**
 * Post-processing pass: every PROCESS or DECISION node left with more than
 * one incoming edge gets a MERGE node in front of it.
 */
final class MergeNodeInserter {

    static final String LABEL_PREFIX = "Merge before ";

    private final IdGenerator idGenerator;

    MergeNodeInserter(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * @return number of MERGE nodes inserted
     */
    int insertMerges(MutableFlow flow, Instant now, FlowEventListener listener) {
        var candidates = flow.nodes().stream()
                .filter(node -> node.is(NodeType.PROCESS) || node.is(NodeType.DECISION))
                .filter(node -> flow.incomingCount(node.getId()) > 1)
                .toList();

        for (ProcessNode target : candidates) {
            insertMergeBefore(flow, target, now, listener);
        }
        return candidates.size();
    }

    private void insertMergeBefore(MutableFlow flow, ProcessNode target, Instant now, FlowEventListener listener) {
        var merge = ProcessNode.builder()
                .id(idGenerator.nextId())
                .type(NodeType.MERGE)
                .label(LABEL_PREFIX + target.getLabel())
                .createdAt(now)
                .updatedAt(now)
                .build();
        flow.putNode(merge);

        List<ProcessEdge> incoming = flow.incomingEdges(target.getId());
        for (ProcessEdge edge : incoming) {
            flow.replaceEdge(edge.withTarget(merge.getId()).withUpdatedAt(now));
        }

        flow.addEdge(ProcessEdge.builder()
                .id(idGenerator.nextId())
                .source(merge.getId())
                .target(target.getId())
                .createdAt(now)
                .updatedAt(now)
                .build());

        listener.onMergeInserted(target.getId(), merge.getId(), incoming.size());
    }
}
