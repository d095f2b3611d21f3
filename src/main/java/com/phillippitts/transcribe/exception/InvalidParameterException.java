package com.phillippitts.transcribe.exception;

/**
 * Thrown when a transcription parameter is outside its accepted range.
 */
public class InvalidParameterException extends TranscribeException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
