package com.phillippitts.transcribe.service.model;

import java.util.Objects;

/**
 * Point-in-time view of the model lifecycle, safe to read from any thread.
 *
 * @param state          current lifecycle state
 * @param engineLoaded   whether an engine handle is set
 * @param failureMessage load failure message when {@code state == FAILED}, else null
 * @param model          configured model identifier
 * @param device         configured compute device
 * @param computeType    configured compute profile
 */
public record ModelStatus(
        LoadState state,
        boolean engineLoaded,
        String failureMessage,
        String model,
        String device,
        String computeType
) {
    public ModelStatus {
        Objects.requireNonNull(state, "state");
    }

    public boolean isReady() {
        return state == LoadState.READY;
    }

    ModelStatus withState(LoadState newState, boolean loaded, String failure) {
        return new ModelStatus(newState, loaded, failure, model, device, computeType);
    }
}
