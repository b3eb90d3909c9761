package com.flow.mapper.service.translate;

import com.flow.mapper.service.labeling.SequentialLabeler;
import com.flow.mapper.service.model.FlowPatch;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.model.ProcessFlow;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.patch.PatchApplier;
import com.flow.mapper.service.topology.TopologyValidator;
import com.flow.mapper.service.translate.stage.ConvergenceFixStage;
import com.flow.mapper.service.translate.stage.DanglingConnectionStage;
import com.flow.mapper.service.translate.stage.DecisionFixStage;
import com.flow.mapper.service.translate.stage.EdgeSynthesisStage;
import com.flow.mapper.service.translate.stage.LoopFixStage;
import com.flow.mapper.service.translate.stage.NodeSynthesisStage;
import com.flow.mapper.service.translate.stage.TerminalNormalizationStage;
import com.flow.mapper.service.translate.stage.TranslationStage;
import com.flow.mapper.service.translate.stage.TranslationState;

import java.time.Clock;
import java.util.List;

/**
 * Turns a semantic {@link ProcessIntent} into a {@link FlowPatch} that yields
 * a valid graph when applied to the given one.
 *
 * <p>Translation runs in three phases:
 * <ol>
 *   <li>a fatal pre-check that rejects empty or meaningless intents</li>
 *   <li>a fixed pipeline of stages, each a function from one
 *       {@link TranslationState} to the next</li>
 *   <li>a bounded validate-and-repair loop that dry-runs the patch</li>
 * </ol>
 *
 * <p>The existing graph is never modified. Ids of synthesized nodes and edges
 * come from the injected {@link IdGenerator}, so a sequential generator makes
 * the output fully reproducible.
 */
public class IntentTranslator {

    public static final String SOURCE = "intent_translator";
    public static final String SOURCE_REPAIRED = "intent_translator_repaired";

    private final IntentPreCheck preCheck;
    private final List<TranslationStage> stages;
    private final PatchRepairer repairer;
    private final TranslatorOptions options;
    private final Clock clock;
    private final FlowEventListener listener;

    public IntentTranslator(IntentPreCheck preCheck, LabelSimilarity similarity, TopologyValidator validator,
                            SequentialLabeler labeler, IdGenerator idGenerator, Clock clock,
                            TranslatorOptions options, FlowEventListener listener) {
        this.preCheck = preCheck;
        this.options = options;
        this.clock = clock;
        this.listener = listener;
        this.stages = List.of(
                new NodeSynthesisStage(idGenerator, similarity),
                new EdgeSynthesisStage(idGenerator, listener),
                new LoopFixStage(idGenerator),
                new ConvergenceFixStage(idGenerator),
                new DecisionFixStage(),
                new TerminalNormalizationStage(idGenerator),
                new DanglingConnectionStage(idGenerator));

        var scratchApplier = new PatchApplier(validator, labeler, IdGenerator.sequential("scratch"),
                clock, FlowEventListener.NOOP);
        this.repairer = new PatchRepairer(scratchApplier, idGenerator, clock, listener, options.maxRepairAttempts());
    }

    /**
     * Translates an intent against nothing.
     */
    public Translation translate(ProcessIntent intent) {
        return translate(intent, ProcessFlow.empty());
    }

    /**
     * @param intent   what the process looks like
     * @param existing graph to extend; {@code null} or empty for a new graph
     * @throws TranslationException when the intent is rejected by the pre-check,
     *                              or violations survive under {@link RepairPolicy#STRICT}
     */
    public Translation translate(ProcessIntent intent, ProcessFlow existing) {
        check(intent);

        var state = TranslationState.initial(intent, existing);
        for (TranslationStage stage : stages) {
            state = stage.apply(state);
            listener.onTranslationStage(stage.name(), state.operations().size());
        }

        var outcome = repairer.repair(state.existing(), state.operations());
        var remaining = outcome.preview().violations();
        if (!remaining.isEmpty() && options.repairPolicy() == RepairPolicy.STRICT) {
            var message = remaining.size() + " topology violation(s) left after "
                    + outcome.repairRounds() + " repair round(s)";
            listener.onTranslationRejected(TranslationException.Reason.UNREPAIRABLE.name(), message);
            throw new TranslationException(TranslationException.Reason.UNREPAIRABLE, message, remaining);
        }

        var source = outcome.repairRounds() > 0 ? SOURCE_REPAIRED : SOURCE;
        var patch = FlowPatch.of(source, clock.instant(), outcome.operations());
        listener.onTranslationCompleted(patch, state.incremental(), remaining);

        return new Translation(patch, outcome.preview().flow(), remaining, state.incremental(), outcome.repairRounds());
    }

    private void check(ProcessIntent intent) {
        try {
            preCheck.check(intent);
        } catch (TranslationException e) {
            listener.onTranslationRejected(e.getReason().name(), e.getMessage());
            throw e;
        }
    }
}
