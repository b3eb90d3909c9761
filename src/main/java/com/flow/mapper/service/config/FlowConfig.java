package com.flow.mapper.service.config;

import com.flow.mapper.service.patch.PatchHistory;
import com.flow.mapper.service.translate.IntentPreCheck;
import com.flow.mapper.service.translate.LabelSimilarity;
import com.flow.mapper.service.translate.RepairPolicy;
import com.flow.mapper.service.translate.TranslatorOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Overall application configuration for Flow Mapper Service.
 *
 * Holds the tuning of the patch engine, the intent translator and the flow store.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
public class FlowConfig {

    /**
     * Feature flags for optional behaviour.
     */
    private Features features = new Features();

    /**
     * Undo history kept per flow.
     */
    private History history = new History();

    /**
     * In-memory flow store limits.
     */
    private Store store = new Store();

    /**
     * Intent translator tuning.
     */
    private Translator translator = new Translator();

    @Getter
    @Setter
    public static class Features {

        /**
         * Renumber PROCESS nodes in flow order after every applied patch.
         */
        private boolean relabelOnApply = true;
    }

    @Getter
    @Setter
    public static class History {

        /**
         * Number of patches that can be rolled back per flow.
         */
        private int capacity = PatchHistory.DEFAULT_CAPACITY;
    }

    @Getter
    @Setter
    public static class Store {

        /**
         * Maximum number of flows held in memory.
         */
        private int maxFlows = 1000;
    }

    @Getter
    @Setter
    public static class Translator {

        /**
         * What to do when violations survive the repair loop.
         */
        private RepairPolicy repairPolicy = RepairPolicy.BEST_EFFORT;

        /**
         * Upper bound on validate-and-repair rounds.
         */
        private int maxRepairAttempts = TranslatorOptions.DEFAULT_MAX_REPAIR_ATTEMPTS;

        /**
         * Phrases marking a step as non-business chatter.
         */
        private List<String> denylist = new ArrayList<>(IntentPreCheck.DEFAULT_DENYLIST);

        /**
         * Fuzzy label matching thresholds.
         */
        private Similarity similarity = new Similarity();

        public TranslatorOptions toOptions() {
            return new TranslatorOptions(maxRepairAttempts, repairPolicy);
        }
    }

    @Getter
    @Setter
    public static class Similarity {

        /**
         * Minimum number of words two labels must share.
         */
        private int minSharedTokens = LabelSimilarity.DEFAULT_MIN_SHARED_TOKENS;

        /**
         * Minimum share of the shorter label's words that must be common.
         */
        private double minOverlapRatio = LabelSimilarity.DEFAULT_MIN_OVERLAP_RATIO;
    }
}
