package com.phillippitts.transcribe.service.model;

/**
 * States of the model lifecycle. {@link #READY} and {@link #FAILED} are terminal.
 */
public enum LoadState {
    UNINITIALIZED,
    LOADING,
    READY,
    FAILED
}
