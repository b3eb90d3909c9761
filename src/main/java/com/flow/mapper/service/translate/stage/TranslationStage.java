package com.flow.mapper.service.translate.stage;

/**
 * One step of the intent translation pipeline.
 */
public interface TranslationStage {

    String name();

    TranslationState apply(TranslationState state);
}
