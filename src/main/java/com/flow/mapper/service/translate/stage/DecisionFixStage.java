package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.topology.TopologyRules;

/**
 * A new DECISION with fewer than two proposed branches is reclassified as PROCESS.
 */
public class DecisionFixStage implements TranslationStage {

    @Override
    public String name() {
        return "decision-fix";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        var next = state;
        for (ProcessNode node : state.pendingNodes()) {
            if (node.is(NodeType.DECISION)
                    && state.pendingEdgesFrom(node.getId()).size() < TopologyRules.MIN_DECISION_BRANCHES) {
                next = next.withNode(node.withType(NodeType.PROCESS));
            }
        }
        return next;
    }
}
