package com.phillippitts.transcribe.service.stt;

/**
 * Builds the speech engine. Invoked at most once per process by
 * {@link com.phillippitts.transcribe.service.model.ModelLifecycleManager}, on its loader thread.
 */
@FunctionalInterface
public interface SpeechEngineFactory {

    /**
     * Resolves, validates and loads the configured model.
     *
     * @return a ready engine
     * @throws com.phillippitts.transcribe.exception.ModelNotFoundException if the model or
     *         binary is missing or invalid
     */
    SpeechEngine create();
}
