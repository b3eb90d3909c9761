package com.flow.mapper.service.config;

import com.flow.mapper.service.labeling.SequentialLabeler;
import com.flow.mapper.service.model.IdGenerator;
import com.flow.mapper.service.observability.FlowEventListener;
import com.flow.mapper.service.patch.PatchApplier;
import com.flow.mapper.service.topology.TopologyValidator;
import com.flow.mapper.service.translate.IntentPreCheck;
import com.flow.mapper.service.translate.IntentTranslator;
import com.flow.mapper.service.translate.LabelSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the graph core (validator, labeler, patch applier, intent translator)
 * as Spring beans for injection into the service layer.
 */
@Slf4j
@Configuration
public class FlowEngineConfig {

    @Bean
    public Clock flowClock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return IdGenerator.uuid();
    }

    /**
     * Degree rules checker, shared by the patch engine and the translator.
     */
    @Bean
    public TopologyValidator topologyValidator() {
        log.info("Initializing TopologyValidator");
        return new TopologyValidator();
    }

    @Bean
    public SequentialLabeler sequentialLabeler() {
        return new SequentialLabeler();
    }

    /**
     * Stateless patch application; each flow wraps it in its own engine and history.
     */
    @Bean
    public PatchApplier patchApplier(TopologyValidator validator, SequentialLabeler labeler,
                                     IdGenerator idGenerator, Clock flowClock, FlowEventListener listener) {
        log.info("Initializing PatchApplier");
        return new PatchApplier(validator, labeler, idGenerator, flowClock, listener);
    }

    @Bean
    public LabelSimilarity labelSimilarity(FlowConfig flowConfig) {
        var similarity = flowConfig.getTranslator().getSimilarity();
        log.info("Initializing LabelSimilarity (minSharedTokens={}, minOverlapRatio={})",
                similarity.getMinSharedTokens(), similarity.getMinOverlapRatio());
        return new LabelSimilarity(similarity.getMinSharedTokens(), similarity.getMinOverlapRatio());
    }

    @Bean
    public IntentPreCheck intentPreCheck(FlowConfig flowConfig) {
        return new IntentPreCheck(flowConfig.getTranslator().getDenylist());
    }

    @Bean
    public IntentTranslator intentTranslator(IntentPreCheck preCheck, LabelSimilarity similarity,
                                             TopologyValidator validator, SequentialLabeler labeler,
                                             IdGenerator idGenerator, Clock flowClock,
                                             FlowConfig flowConfig, FlowEventListener listener) {
        var options = flowConfig.getTranslator().toOptions();
        log.info("Initializing IntentTranslator (repairPolicy={}, maxRepairAttempts={})",
                options.repairPolicy(), options.maxRepairAttempts());
        return new IntentTranslator(preCheck, similarity, validator, labeler, idGenerator, flowClock,
                options, listener);
    }
}
