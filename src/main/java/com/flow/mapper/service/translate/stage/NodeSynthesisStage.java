package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.AutomationLevel;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.translate.IntentFlow;
import com.flow.mapper.service.translate.IntentStep;
import com.flow.mapper.service.translate.IntentStepType;
import com.flow.mapper.service.translate.LabelSimilarity;
import com.flow.mapper.service.translate.ProcessIntent;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

/**
 * Proposes one node per step that the graph does not already contain.
 * Steps matching an existing node by label are mapped onto that node instead.
 */
public class NodeSynthesisStage implements TranslationStage {

    private final IdGenerator idGenerator;
    private final LabelSimilarity similarity;

    public NodeSynthesisStage(IdGenerator idGenerator, LabelSimilarity similarity) {
        this.idGenerator = idGenerator;
        this.similarity = similarity;
    }

    @Override
    public String name() {
        return "node-synthesis";
    }

    @Override
    public TranslationState apply(TranslationState state) {
        var intent = state.intent();
        var stepNodeIds = new HashMap<>(state.stepNodeIds());
        var inferredStarts = new HashSet<>(state.inferredStartNodeIds());
        boolean explicitStart = intent.hasExplicitStart();

        var next = state;
        for (IntentStep step : intent.steps()) {
            var match = similarity.findMatch(step.text(), state.existing().nodes());
            if (match.isPresent()) {
                putStep(stepNodeIds, step, match.get().getId());
                continue;
            }

            var type = typeOf(step, intent, explicitStart);
            var node = ProcessNode.builder()
                    .id(idGenerator.nextId())
                    .type(type)
                    .label(step.text())
                    .owner(step.who())
                    .system(step.tool())
                    .automation(AutomationLevel.fromText(step.manualAuto()))
                    .build();
            next = next.withNode(node);
            putStep(stepNodeIds, step, node.getId());
            if (type == NodeType.START && step.stepType() != IntentStepType.START_POINT) {
                inferredStarts.add(node.getId());
            }
        }

        return next.withStepNodeIds(stepNodeIds).withInferredStartNodeIds(inferredStarts);
    }

    /**
     * END is only ever taken from an explicit tag, never inferred.
     */
    static NodeType typeOf(IntentStep step, ProcessIntent intent, boolean explicitStart) {
        return switch (step.stepType()) {
            case START_POINT -> NodeType.START;
            case END_POINT -> NodeType.END;
            case DECISION -> NodeType.DECISION;
            case STEP -> inferType(step, intent, explicitStart);
        };
    }

    private static NodeType inferType(IntentStep step, ProcessIntent intent, boolean explicitStart) {
        List<IntentFlow> outgoing = step.id() == null ? List.of() : intent.flowsFrom(step.id());
        if (outgoing.size() > 1 || outgoing.stream().anyMatch(IntentFlow::isConditional)) {
            return NodeType.DECISION;
        }
        long incoming = step.id() == null ? 0 : intent.incomingFlowCount(step.id());
        if (!explicitStart && incoming == 0 && !outgoing.isEmpty()) {
            return NodeType.START;
        }
        return NodeType.PROCESS;
    }

    private static void putStep(HashMap<String, String> stepNodeIds, IntentStep step, String nodeId) {
        if (step.id() != null) {
            stepNodeIds.putIfAbsent(step.id(), nodeId);
        }
    }
}
