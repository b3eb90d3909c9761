package com.flow.mapper.service.topology;

import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.topology.TopologyViolation.Direction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a graph against the per-type degree rules of {@link TopologyRules}.
 *
 * Stateless and side-effect free; safe to share.
 */
public class TopologyValidator {

    /**
     * Validates a graph.
     *
     * @param flow the graph to check
     * @return one violation per breached rule, in node order; empty when the graph is valid
     */
    public List<TopologyViolation> validate(ProcessFlow flow) {
        var violations = new ArrayList<TopologyViolation>();
        Set<String> nodeIds = flow.nodes().stream()
                .map(ProcessNode::getId)
                .collect(Collectors.toSet());

        Map<String, Long> incoming = new HashMap<>();
        Map<String, Long> outgoing = new HashMap<>();

        for (ProcessEdge edge : flow.edges()) {
            if (!nodeIds.contains(edge.getSource())) {
                violations.add(TopologyViolation.danglingEdge(edge.getId(), edge.getSource(), Direction.OUTGOING));
                continue;
            }
            if (!nodeIds.contains(edge.getTarget())) {
                violations.add(TopologyViolation.danglingEdge(edge.getId(), edge.getTarget(), Direction.INCOMING));
                continue;
            }
            outgoing.merge(edge.getSource(), 1L, Long::sum);
            incoming.merge(edge.getTarget(), 1L, Long::sum);
        }

        for (ProcessNode node : flow.nodes()) {
            long in = incoming.getOrDefault(node.getId(), 0L);
            long out = outgoing.getOrDefault(node.getId(), 0L);

            var inRange = TopologyRules.incoming(node.getType());
            if (!inRange.contains(in)) {
                violations.add(TopologyViolation.degree(node.getId(), node.getType(), Direction.INCOMING, inRange, in));
            }

            var outRange = TopologyRules.outgoing(node.getType());
            if (!outRange.contains(out)) {
                violations.add(TopologyViolation.degree(node.getId(), node.getType(), Direction.OUTGOING, outRange, out));
            }
        }

        return violations;
    }

    public boolean isValid(ProcessFlow flow) {
        return validate(flow).isEmpty();
    }
}
