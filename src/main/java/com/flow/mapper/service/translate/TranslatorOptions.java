package com.flow.mapper.service.translate;

/**
 * Tuning of the validate-and-repair loop.
 *
 * @param maxRepairAttempts upper bound on repair rounds
 * @param repairPolicy      what happens when violations survive the loop
 */
public record TranslatorOptions(int maxRepairAttempts, RepairPolicy repairPolicy) {

    public static final int DEFAULT_MAX_REPAIR_ATTEMPTS = 3;

    public TranslatorOptions {
        if (maxRepairAttempts < 1) {
            throw new IllegalArgumentException("maxRepairAttempts must be positive: " + maxRepairAttempts);
        }
        repairPolicy = repairPolicy == null ? RepairPolicy.BEST_EFFORT : repairPolicy;
    }

    public static TranslatorOptions defaults() {
        return new TranslatorOptions(DEFAULT_MAX_REPAIR_ATTEMPTS, RepairPolicy.BEST_EFFORT);
    }
}
