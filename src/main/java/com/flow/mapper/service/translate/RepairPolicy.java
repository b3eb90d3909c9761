package com.flow.mapper.service.translate;

/**
 * What the translator does when violations survive the repair loop.
 */
public enum RepairPolicy {

    /**
     * Return the best patch found; remaining violations are reported, not thrown.
     */
    BEST_EFFORT,

    /**
     * Reject the intent with a {@link TranslationException}.
     */
    STRICT
}
