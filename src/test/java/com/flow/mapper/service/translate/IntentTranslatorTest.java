package com.flow.mapper.service.translate;

import com.flow.mapper.service.labeling.SequentialLabeler;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.NodeType;
import com.flow.mapper.service.model.PatchOperation;
import com.flow.mapper.service.model.ProcessEdge;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.model.ProcessNode;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.topology.TopologyValidator;
import com.flow.mapper.service.topology.TopologyViolation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentTranslatorTest {

    private static final Instant NOW = Instant.parse("2026-04-12T09:30:00Z");

    private final TopologyValidator validator = new TopologyValidator();
    private final RecordingListener listener = new RecordingListener();

    // ==================== Fresh Mode ====================

    @Nested
    @DisplayName("Fresh graph")
    class Fresh {

        @Test
        @DisplayName("N sequential steps become START followed by a path of N PROCESS nodes")
        void sequentialSteps() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("s1", "Receive order"), IntentStep.of("s2", "Check stock"),
                            IntentStep.of("s3", "Pack goods"), IntentStep.of("s4", "Ship order")),
                    List.of(IntentFlow.of("s1", "s2"), IntentFlow.of("s2", "s3"), IntentFlow.of("s3", "s4")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent);
            var preview = translation.preview();

            assertThat(translation.isValid()).isTrue();
            assertThat(translation.incremental()).isFalse();
            assertThat(translation.isRepaired()).isFalse();
            assertThat(translation.patch().source()).isEqualTo(IntentTranslator.SOURCE);
            assertThat(translation.patch().createdAt()).isEqualTo(NOW);

            assertThat(preview.nodesOfType(NodeType.START)).singleElement()
                    .satisfies(start -> assertThat(start.getLabel()).isEqualTo("Start process"));
            assertThat(preview.nodesOfType(NodeType.PROCESS)).hasSize(4);
            assertThat(preview.nodesOfType(NodeType.END)).hasSizeLessThanOrEqualTo(1);
            assertThat(preview.edges()).hasSize(4);

            var start = preview.nodesOfType(NodeType.START).get(0);
            assertThat(pathLabels(preview, start.getId()))
                    .containsExactly("Start process", "Receive order", "Check stock", "Pack goods", "Ship order");
        }

        @Test
        @DisplayName("Order with payment decision yields a valid branching graph")
        void submitOrderScenario() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("s1", "submit order"),
                            new IntentStep("s2", "check payment", IntentStepType.DECISION, null, null, null,
                                    List.of("approved", "rejected")),
                            IntentStep.of("s3", "ship"),
                            IntentStep.of("s4", "refund")),
                    List.of(IntentFlow.of("s1", "s2"),
                            new IntentFlow("s2", "s3", "approved"),
                            new IntentFlow("s2", "s4", "rejected")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent);
            var preview = translation.preview();

            assertThat(validator.validate(preview)).isEmpty();

            var start = preview.nodesOfType(NodeType.START).get(0);
            var submit = byLabel(preview, "submit order");
            var check = byLabel(preview, "check payment");
            assertThat(submit.getType()).isEqualTo(NodeType.PROCESS);
            assertThat(check.getType()).isEqualTo(NodeType.DECISION);
            assertThat(byLabel(preview, "ship").getType()).isEqualTo(NodeType.PROCESS);
            assertThat(byLabel(preview, "refund").getType()).isEqualTo(NodeType.PROCESS);

            assertThat(preview.outgoingEdges(start.getId())).singleElement()
                    .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo(submit.getId()));
            assertThat(preview.outgoingEdges(submit.getId())).singleElement()
                    .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo(check.getId()));
            assertThat(preview.outgoingEdges(check.getId()))
                    .extracting(ProcessEdge::getCondition)
                    .containsExactly("approved", "rejected");
        }

        @Test
        @DisplayName("Decision step with a single outgoing flow is downgraded to PROCESS")
        void singleBranchDecisionIsDowngraded() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "Receive request"),
                            IntentStep.of("d", "Is it urgent", IntentStepType.DECISION),
                            IntentStep.of("b", "Handle request")),
                    List.of(IntentFlow.of("a", "d"), IntentFlow.of("d", "b")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent);

            var proposed = translation.patch().operations().stream()
                    .filter(PatchOperation.AddNode.class::isInstance)
                    .map(op -> ((PatchOperation.AddNode) op).node())
                    .filter(node -> node.getLabel().equals("Is it urgent"))
                    .findFirst()
                    .orElseThrow();
            assertThat(proposed.getType()).isEqualTo(NodeType.PROCESS);
            assertThat(translation.preview().nodesOfType(NodeType.DECISION)).isEmpty();
            assertThat(translation.isValid()).isTrue();
        }

        @Test
        @DisplayName("Disconnected parts are joined by the repair loop")
        void orphanIsRepaired() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "Open ticket"), IntentStep.of("b", "Assign agent"),
                            IntentStep.of("c", "Call customer"), IntentStep.of("d", "Close ticket")),
                    List.of(IntentFlow.of("a", "b"), IntentFlow.of("c", "d")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent);

            assertThat(translation.isValid()).isTrue();
            assertThat(translation.repairRounds()).isEqualTo(1);
            assertThat(translation.patch().source()).isEqualTo(IntentTranslator.SOURCE_REPAIRED);

            var preview = translation.preview();
            var assign = byLabel(preview, "Assign agent");
            var call = byLabel(preview, "Call customer");
            assertThat(preview.outgoingEdges(assign.getId())).singleElement()
                    .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo(call.getId()));
            assertThat(listener.repairs).containsExactly(1);
        }

        @Test
        @DisplayName("Pipeline stages report in a fixed order")
        void stagesRunInOrder() {
            var intent = ProcessIntent.of(List.of(IntentStep.of("a", "Approve invoice")), List.of());

            translator(RepairPolicy.BEST_EFFORT).translate(intent);

            assertThat(listener.stages).containsExactly(
                    "node-synthesis", "edge-synthesis", "loop-fix", "convergence-fix",
                    "decision-fix", "terminal-normalization", "dangling-connection");
        }

        @Test
        @DisplayName("Flows naming unknown steps are skipped")
        void unknownStepsAreSkipped() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "Approve invoice"), IntentStep.of("b", "Pay invoice")),
                    List.of(IntentFlow.of("a", "b"), IntentFlow.of("b", "nowhere")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent);

            assertThat(translation.isValid()).isTrue();
            assertThat(listener.skipped).containsExactly("b->nowhere: unknown step");
        }

        @Test
        @DisplayName("Same intent and seed give the same patch")
        void reproducible() {
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "Approve invoice"), IntentStep.of("b", "Pay invoice")),
                    List.of(IntentFlow.of("a", "b")));

            var first = translator(RepairPolicy.BEST_EFFORT).translate(intent);
            var second = translator(RepairPolicy.BEST_EFFORT).translate(intent);

            assertThat(first.patch()).isEqualTo(second.patch());
            assertThat(first.preview()).isEqualTo(second.preview());
        }
    }

    // ==================== Incremental Mode ====================

    @Nested
    @DisplayName("Existing graph")
    class Incremental {

        @Test
        @DisplayName("A start_point step never becomes a second START")
        void startPointIsDowngraded() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order"),
                            node("p2", NodeType.PROCESS, "Check stock"), node("p3", NodeType.PROCESS, "Ship order")),
                    List.of(edge("e1", "s", "p1"), edge("e2", "p1", "p2"), edge("e3", "p2", "p3")));
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("x", "Kick off quarterly review", IntentStepType.START_POINT)),
                    List.of());

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);
            var preview = translation.preview();

            assertThat(translation.incremental()).isTrue();
            assertThat(preview.nodesOfType(NodeType.START)).extracting(ProcessNode::getId).containsExactly("s");
            var added = byLabel(preview, "Kick off quarterly review");
            assertThat(added.getType()).isEqualTo(NodeType.PROCESS);
            assertThat(preview.incomingEdges(added.getId())).singleElement()
                    .satisfies(edge -> assertThat(edge.getSource()).isEqualTo("p3"));
            assertThat(translation.isValid()).isTrue();
        }

        @Test
        @DisplayName("Steps matching existing nodes are reused and new steps are appended")
        void appendsAfterMatchedStep() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order")),
                    List.of(edge("e1", "s", "p1")));
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "receive  ORDER"), IntentStep.of("b", "Send invoice")),
                    List.of(IntentFlow.of("a", "b")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);
            var preview = translation.preview();

            assertThat(preview.nodes()).hasSize(3);
            var invoice = byLabel(preview, "Send invoice");
            assertThat(preview.outgoingEdges("p1")).singleElement()
                    .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo(invoice.getId()));
            assertThat(translation.isValid()).isTrue();
            assertThat(existing.nodes()).hasSize(2);
        }

        @Test
        @DisplayName("A flow out of an already connected START is skipped and nothing is orphaned")
        void connectedStartIsNotRewired() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order"),
                            node("p2", NodeType.PROCESS, "Ship order")),
                    List.of(edge("e1", "s", "p1"), edge("e2", "p1", "p2")));
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("a", "Start"), IntentStep.of("b", "Ship order")),
                    List.of(IntentFlow.of("a", "b")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);

            assertThat(translation.patch().operations())
                    .noneMatch(PatchOperation.DeleteEdge.class::isInstance);
            assertThat(translation.preview().findEdge("e1")).isPresent();
            assertThat(translation.preview().incomingCount("p1")).isEqualTo(1);
            assertThat(translation.isValid()).isTrue();
            assertThat(listener.skipped).containsExactly("a->b: START already has an outgoing edge");
        }

        @Test
        @DisplayName("Two new flows into an existing step share one MERGE node")
        void convergingFlowsShareOneMerge() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order"),
                            node("p2", NodeType.PROCESS, "Ship order")),
                    List.of(edge("e1", "s", "p1"), edge("e2", "p1", "p2")));
            var intent = ProcessIntent.of(
                    List.of(IntentStep.of("d", "Payment ok", IntentStepType.DECISION),
                            IntentStep.of("x", "Charge card"),
                            IntentStep.of("z", "Request bank transfer"),
                            IntentStep.of("y", "Ship order")),
                    List.of(new IntentFlow("d", "x", "yes"), new IntentFlow("d", "z", "no"),
                            IntentFlow.of("x", "y"), IntentFlow.of("z", "y")));

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);
            var preview = translation.preview();

            assertThat(preview.nodesOfType(NodeType.MERGE)).singleElement()
                    .satisfies(merge -> {
                        assertThat(merge.getLabel()).isEqualTo("Merge before Ship order");
                        assertThat(preview.incomingCount(merge.getId())).isEqualTo(3);
                        assertThat(preview.outgoingEdges(merge.getId())).singleElement()
                                .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo("p2"));
                    });
            assertThat(preview.incomingCount("p2")).isEqualTo(1);
            assertThat(preview.findEdge("e2")).isEmpty();
            assertThat(translation.isValid()).isTrue();
        }
    }

    // ==================== Repair Loop ====================

    @Nested
    @DisplayName("Repair loop")
    class Repair {

        @Test
        @DisplayName("A DECISION left with one branch gets an else edge to a new END")
        void singleBranchDecisionGetsElseBranch() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("d", NodeType.DECISION, "Payment approved"),
                            node("p", NodeType.PROCESS, "Ship order")),
                    List.of(edge("e1", "s", "d"),
                            ProcessEdge.builder().id("e2").source("d").target("p").condition("yes").build()));
            var intent = ProcessIntent.of(List.of(IntentStep.of("a", "Notify customer")), List.of());

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);
            var preview = translation.preview();

            assertThat(translation.isValid()).isTrue();
            assertThat(translation.repairRounds()).isEqualTo(1);
            assertThat(translation.patch().source()).isEqualTo(IntentTranslator.SOURCE_REPAIRED);
            assertThat(listener.repairs).containsExactly(1);

            var end = byLabel(preview, PatchRepairer.END_LABEL);
            assertThat(end.getType()).isEqualTo(NodeType.END);
            assertThat(preview.outgoingEdges("d"))
                    .extracting(ProcessEdge::getCondition)
                    .containsExactly("yes", PatchRepairer.ELSE_CONDITION);
            assertThat(preview.incomingEdges(end.getId())).singleElement()
                    .satisfies(edge -> {
                        assertThat(edge.getSource()).isEqualTo("d");
                        assertThat(edge.getCondition()).isEqualTo("else");
                    });
            assertThat(translation.patch().operations())
                    .filteredOn(PatchOperation.AddNode.class::isInstance)
                    .extracting(op -> ((PatchOperation.AddNode) op).node().getLabel())
                    .containsExactlyInAnyOrder("Notify customer", "End process");
        }

        @Test
        @DisplayName("A START with nothing after it is wired to the first unreached step")
        void unconnectedStartIsWired() {
            var existing = ProcessFlow.of(
                    List.of(node("s", NodeType.START, "Start"), node("p1", NodeType.PROCESS, "Receive order"),
                            node("p2", NodeType.PROCESS, "Ship order")),
                    List.of(edge("e1", "p1", "p2")));
            var intent = ProcessIntent.of(List.of(IntentStep.of("a", "Notify customer")), List.of());

            var translation = translator(RepairPolicy.BEST_EFFORT).translate(intent, existing);
            var preview = translation.preview();

            assertThat(translation.isValid()).isTrue();
            assertThat(translation.repairRounds()).isEqualTo(1);
            assertThat(translation.patch().source()).isEqualTo(IntentTranslator.SOURCE_REPAIRED);
            assertThat(listener.repairs).containsExactly(1);

            assertThat(translation.patch().operations())
                    .filteredOn(PatchOperation.AddEdge.class::isInstance)
                    .extracting(op -> ((PatchOperation.AddEdge) op).edge())
                    .anySatisfy(edge -> {
                        assertThat(edge.getSource()).isEqualTo("s");
                        assertThat(edge.getTarget()).isEqualTo("p1");
                    });
            assertThat(preview.outgoingEdges("s")).singleElement()
                    .satisfies(edge -> assertThat(edge.getTarget()).isEqualTo("p1"));
            var notify = byLabel(preview, "Notify customer");
            assertThat(preview.incomingEdges(notify.getId())).singleElement()
                    .satisfies(edge -> assertThat(edge.getSource()).isEqualTo("p2"));
            assertThat(preview.nodesOfType(NodeType.END)).isEmpty();
        }
    }

    // ==================== Repair Policy ====================

    @Nested
    @DisplayName("Repair policy")
    class Policy {

        private final ProcessIntent unreachableEnd = ProcessIntent.of(
                List.of(IntentStep.of("a", "Collect documents"), IntentStep.of("b", "Review documents"),
                        IntentStep.of("e", "Archive file", IntentStepType.END_POINT)),
                List.of(IntentFlow.of("a", "b")));

        @Test
        @DisplayName("Best effort returns the patch with the violations it could not fix")
        void bestEffortKeepsViolations() {
            var translation = translator(RepairPolicy.BEST_EFFORT).translate(unreachableEnd);

            assertThat(translation.isValid()).isFalse();
            assertThat(translation.remainingViolations()).singleElement()
                    .satisfies(v -> assertThat(v.concerns(NodeType.END, TopologyViolation.Direction.INCOMING)).isTrue());
        }

        @Test
        @DisplayName("Strict rejects a patch that stays invalid")
        void strictRejects() {
            var strict = translator(RepairPolicy.STRICT);

            assertThatThrownBy(() -> strict.translate(unreachableEnd))
                    .isInstanceOfSatisfying(TranslationException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(TranslationException.Reason.UNREPAIRABLE);
                        assertThat(e.getViolations()).hasSize(1);
                    });
            assertThat(listener.rejections).containsExactly("UNREPAIRABLE");
        }

        @Test
        @DisplayName("Pre-check failures surface before any stage runs")
        void preCheckFailure() {
            var empty = ProcessIntent.of(List.of(), List.of());

            assertThatThrownBy(() -> translator(RepairPolicy.BEST_EFFORT).translate(empty))
                    .isInstanceOf(TranslationException.class);
            assertThat(listener.stages).isEmpty();
            assertThat(listener.rejections).containsExactly("NO_STEPS");
        }
    }

    // ==================== Helpers ====================

    private IntentTranslator translator(RepairPolicy policy) {
        return new IntentTranslator(new IntentPreCheck(), new LabelSimilarity(), validator,
                new SequentialLabeler(), IdGenerator.sequential("n"), Clock.fixed(NOW, ZoneOffset.UTC),
                new TranslatorOptions(TranslatorOptions.DEFAULT_MAX_REPAIR_ATTEMPTS, policy), listener);
    }

    private static List<String> pathLabels(ProcessFlow flow, String fromId) {
        var labels = new ArrayList<String>();
        String current = fromId;
        while (current != null && labels.size() <= flow.nodes().size()) {
            labels.add(flow.findNode(current).orElseThrow().getLabel());
            var next = flow.outgoingEdges(current);
            current = next.isEmpty() ? null : next.get(0).getTarget();
        }
        return labels;
    }

    private static ProcessNode byLabel(ProcessFlow flow, String label) {
        return flow.nodes().stream()
                .filter(node -> label.equals(node.getLabel()))
                .findFirst()
                .orElseThrow();
    }

    private static ProcessNode node(String id, NodeType type, String label) {
        return ProcessNode.builder().id(id).type(type).label(label).build();
    }

    private static ProcessEdge edge(String id, String source, String target) {
        return ProcessEdge.builder().id(id).source(source).target(target).build();
    }

    private static class RecordingListener implements FlowEventListener {
        final List<String> stages = new ArrayList<>();
        final List<Integer> repairs = new ArrayList<>();
        final List<String> rejections = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();

        @Override
        public void onTranslationStage(String stage, int pendingOperations) {
            stages.add(stage);
        }

        @Override
        public void onTranslationRepair(int attempt, List<TopologyViolation> violations, int repairOperations) {
            repairs.add(attempt);
        }

        @Override
        public void onTranslationRejected(String reason, String message) {
            rejections.add(reason);
        }

        @Override
        public void onFlowSkipped(String fromStep, String toStep, String reason) {
            skipped.add(fromStep + "->" + toStep + ": " + reason);
        }
    }
}
