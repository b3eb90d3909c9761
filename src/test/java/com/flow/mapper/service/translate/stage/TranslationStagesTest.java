package com.flow.mapper.service.translate.stage;

import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.translate.IntentFlow;
import com.flow.mapper.service.translate.IntentStep;
import com.flow.mapper.service.translate.IntentStepType;
import com.flow.mapper.service.translate.LabelSimilarity;
import com.flow.mapper.service.translate.ProcessIntent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stage-level checks; the full pipeline is covered by IntentTranslatorTest.
 */
class TranslationStagesTest {

    private final IdGenerator ids = IdGenerator.sequential("t");

    @Test
    @DisplayName("Node synthesis infers START, DECISION and PROCESS from the flows")
    void nodeSynthesisInfersTypes() {
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("a", "Receive claim"), IntentStep.of("b", "Assess claim"),
                        IntentStep.of("c", "Pay out"), IntentStep.of("d", "Decline")),
                List.of(IntentFlow.of("a", "b"), IntentFlow.of("b", "c"), IntentFlow.of("b", "d")));

        var state = new NodeSynthesisStage(ids, new LabelSimilarity())
                .apply(TranslationState.initial(intent, null));

        assertThat(state.pendingNodes()).extracting(ProcessNode::getType).containsExactly(
                NodeType.START, NodeType.DECISION, NodeType.PROCESS, NodeType.PROCESS);
        assertThat(state.inferredStartNodeIds()).containsExactly("t-1");
        assertThat(state.stepNodeIds()).containsEntry("c", "t-3");
        assertThat(state.incremental()).isFalse();
    }

    @Test
    @DisplayName("Node synthesis maps steps onto matching existing nodes")
    void nodeSynthesisReusesExistingNodes() {
        var existing = ProcessFlow.of(List.of(node("p1", NodeType.PROCESS, "Assess the insurance claim")), List.of());
        var intent = ProcessIntent.of(List.of(IntentStep.of("b", "assess insurance claim")), List.of());

        var state = new NodeSynthesisStage(ids, new LabelSimilarity())
                .apply(TranslationState.initial(intent, existing));

        assertThat(state.pendingNodes()).isEmpty();
        assertThat(state.stepNodeIds()).containsEntry("b", "p1");
    }

    @Test
    @DisplayName("A PROCESS source keeps only its last proposed edge")
    void processSourceKeepsLastEdge() {
        var state = TranslationState.initial(ProcessIntent.of(
                        List.of(IntentStep.of("a", "Draft"), IntentStep.of("b", "Review"), IntentStep.of("c", "Publish")),
                        List.of(IntentFlow.of("a", "b"), IntentFlow.of("a", "c"))), null)
                .withNode(node("a", NodeType.PROCESS, "Draft"))
                .withNode(node("b", NodeType.PROCESS, "Review"))
                .withNode(node("c", NodeType.PROCESS, "Publish"))
                .withStepNodeIds(Map.of("a", "a", "b", "b", "c", "c"));

        var next = new EdgeSynthesisStage(ids, FlowEventListener.NOOP).apply(state);

        assertThat(next.pendingEdges()).singleElement()
                .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo("c"));
    }

    @Test
    @DisplayName("Edges into START and out of END are never proposed")
    void terminalsAreRespected() {
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("s", "Begin", IntentStepType.START_POINT), IntentStep.of("p", "Work"),
                        IntentStep.of("e", "Finish", IntentStepType.END_POINT)),
                List.of(IntentFlow.of("s", "p"), IntentFlow.of("p", "e"), IntentFlow.of("e", "p"),
                        IntentFlow.of("p", "s")));

        var synthesized = new NodeSynthesisStage(ids, new LabelSimilarity())
                .apply(TranslationState.initial(intent, null));
        var next = new EdgeSynthesisStage(ids, FlowEventListener.NOOP).apply(synthesized);

        var s = next.stepNodeIds().get("s");
        var p = next.stepNodeIds().get("p");
        var e = next.stepNodeIds().get("e");
        assertThat(next.pendingEdges())
                .extracting(edge -> edge.getSource() + ">" + edge.getTarget())
                .containsExactly(s + ">" + p, p + ">" + e);
    }

    @Test
    @DisplayName("A connected START keeps its edge and the new flow is dropped")
    void connectedStartKeepsItsEdge() {
        var existing = ProcessFlow.of(
                List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order"),
                        node("p2", NodeType.PROCESS, "Ship order")),
                List.of(edge("e1", "s", "p1"), edge("e2", "p1", "p2")));
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("a", "Start"), IntentStep.of("b", "Ship order")),
                List.of(IntentFlow.of("a", "b")));

        var synthesized = new NodeSynthesisStage(ids, new LabelSimilarity())
                .apply(TranslationState.initial(intent, existing));
        var next = new EdgeSynthesisStage(ids, FlowEventListener.NOOP).apply(synthesized);

        assertThat(next.stepNodeIds()).containsEntry("a", "s");
        assertThat(next.operations()).isEmpty();
        assertThat(next.effectiveOutgoing("s")).isEqualTo(1);
    }

    @Test
    @DisplayName("Several new edges into one node are batched behind a MERGE")
    void batchMerge() {
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), null)
                .withNode(node("a", NodeType.PROCESS, "A"))
                .withNode(node("b", NodeType.PROCESS, "B"))
                .withNode(node("t", NodeType.PROCESS, "Target"));
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("a", "A"), IntentStep.of("b", "B"), IntentStep.of("t", "Target")),
                List.of(IntentFlow.of("a", "t"), IntentFlow.of("b", "t")));
        state = new TranslationState(intent, state.existing(), state.operations(),
                Map.of("a", "a", "b", "b", "t", "t"), Set.of());

        var next = new EdgeSynthesisStage(ids, FlowEventListener.NOOP).apply(state);

        var merges = next.pendingNodes().stream().filter(n -> n.is(NodeType.MERGE)).toList();
        assertThat(merges).singleElement()
                .satisfies(merge -> assertThat(merge.getLabel()).isEqualTo("Merge before Target"));
        assertThat(next.pendingEdgesInto("t")).singleElement()
                .satisfies(edge -> assertThat(edge.getSource()).isEqualTo(merges.get(0).getId()));
        assertThat(next.pendingEdgesInto(merges.get(0).getId())).hasSize(2);
    }

    @Test
    @DisplayName("Fresh mode keeps only the first explicit START and first END")
    void terminalPolicyInFreshMode() {
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), null)
                .withNode(node("s1", NodeType.START, "Begin"))
                .withNode(node("s2", NodeType.START, "Begin again"))
                .withNode(node("e1", NodeType.END, "Done"))
                .withNode(node("e2", NodeType.END, "Also done"));

        var next = new TerminalNormalizationStage(ids).apply(state);

        assertThat(next.pendingNodes()).extracting(ProcessNode::getType).containsExactly(
                NodeType.START, NodeType.PROCESS, NodeType.END, NodeType.PROCESS);
    }

    @Test
    @DisplayName("Incremental mode turns every new terminal into PROCESS")
    void terminalPolicyInIncrementalMode() {
        var existing = ProcessFlow.of(List.of(node("s", NodeType.START, "Start")), List.of());
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), existing)
                .withNode(node("x", NodeType.START, "Another start"))
                .withNode(node("y", NodeType.END, "Another end"));

        assertThat(TerminalPolicy.resolvedType(state, "x")).isEqualTo(NodeType.PROCESS);
        assertThat(TerminalPolicy.resolvedType(state, "y")).isEqualTo(NodeType.PROCESS);
        assertThat(TerminalPolicy.resolvedType(state, "s")).isEqualTo(NodeType.START);
    }

    @Test
    @DisplayName("A DECISION with one proposed branch becomes PROCESS")
    void decisionFix() {
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), null)
                .withNode(node("d", NodeType.DECISION, "Check"))
                .withNode(node("p", NodeType.PROCESS, "Next"))
                .withEdge(ProcessEdge.builder().id("e").source("d").target("p").build());

        var next = new DecisionFixStage().apply(state);

        assertThat(next.pendingNode("d")).get().extracting(ProcessNode::getType).isEqualTo(NodeType.PROCESS);
    }

    @Test
    @DisplayName("Existing dead-ends converge into the first new step")
    void convergence() {
        var existing = ProcessFlow.of(
                List.of(node("s", NodeType.START, "Start"), node("d", NodeType.DECISION, "Route"),
                        node("a", NodeType.PROCESS, "Path A"), node("b", NodeType.PROCESS, "Path B")),
                List.of(edge("e1", "s", "d"), edge("e2", "d", "a"), edge("e3", "d", "b")));
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), existing)
                .withNode(node("n", NodeType.PROCESS, "Report"));

        var next = new ConvergenceFixStage(ids).apply(state);

        var merge = next.pendingNodes().stream().filter(node -> node.is(NodeType.MERGE)).findFirst().orElseThrow();
        assertThat(merge.getLabel()).isEqualTo("Convergence before Report");
        assertThat(next.pendingEdgesInto(merge.getId())).extracting(ProcessEdge::getSource)
                .containsExactly("a", "b");
        assertThat(next.pendingEdgesFrom(merge.getId())).singleElement()
                .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo("n"));
    }

    @Test
    @DisplayName("Unreached new steps hang off the last dead-end of the existing graph")
    void danglingConnection() {
        var existing = ProcessFlow.of(
                List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "First"),
                        node("p2", NodeType.PROCESS, "Second")),
                List.of(edge("e1", "s", "p1"), edge("e2", "p1", "p2")));
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), existing)
                .withNode(node("n", NodeType.PROCESS, "Third"));

        var next = new DanglingConnectionStage(ids).apply(state);

        assertThat(next.pendingEdgesInto("n")).singleElement()
                .satisfies(edge -> assertThat(edge.getSource()).isEqualTo("p2"));
    }

    @Test
    @DisplayName("Loops back into an existing step go through a MERGE")
    void loopFix() {
        var existing = ProcessFlow.of(
                List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Draft")),
                List.of(edge("e1", "s", "p1")));
        var state = TranslationState.initial(ProcessIntent.of(List.of(), List.of()), existing)
                .withNode(node("r", NodeType.PROCESS, "Rework"))
                .withEdge(ProcessEdge.builder().id("back").source("r").target("p1").build());

        var next = new LoopFixStage(ids).apply(state);

        var merge = next.pendingNodes().stream().filter(node -> node.is(NodeType.MERGE)).findFirst().orElseThrow();
        assertThat(merge.getLabel()).isEqualTo("Loop merge before Draft");
        assertThat(next.deletedEdgeIds()).containsExactly("e1");
        assertThat(next.pendingEdgesInto(merge.getId())).extracting(ProcessEdge::getSource)
                .containsExactlyInAnyOrder("s", "r");
        assertThat(next.effectiveIncoming("p1")).isEqualTo(1);
    }

    private static ProcessNode node(String id, NodeType type, String label) {
        return ProcessNode.builder().id(id).type(type).label(label).build();
    }

    private static ProcessEdge edge(String id, String source, String target) {
        return ProcessEdge.builder().id(id).source(source).target(target).build();
    }
}
