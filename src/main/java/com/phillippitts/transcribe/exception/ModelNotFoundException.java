package com.phillippitts.transcribe.exception;

/**
 * Thrown while constructing the speech engine when the model file, the whisper.cpp binary
 * or the VAD model cannot be found or used. Captured by the model lifecycle as its
 * terminal failure message.
 */
public class ModelNotFoundException extends TranscribeException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Speech model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String message, String modelPath) {
        super(message);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String message, String modelPath, Throwable cause) {
        super(message, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
