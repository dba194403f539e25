package com.phillippitts.fonemas.exception;

/**
 * Thrown when a transcription is aborted by one of the pipeline stages.
 * Carries the name of the stage that failed.
 */
public class TranscriptionException extends FonemasException {

    private final String stage;

    public TranscriptionException(String message) {
        super(message);
        this.stage = "unknown";
    }

    public TranscriptionException(String message, String stage) {
        super(message + " (stage: " + stage + ")");
        this.stage = stage;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.stage = "unknown";
    }

    public TranscriptionException(String message, String stage, Throwable cause) {
        super(message + " (stage: " + stage + ")", cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
