package com.phillippitts.fonemas.exception;

/**
 * Thrown when a caller supplies an option value the transcription does not accept
 * (unknown format, exception level out of range, empty stress marker, missing text).
 *
 * <p>Raised before the pipeline runs, so it never indicates a transcription failure.
 */
public class InvalidOptionException extends FonemasException {

    private final String option;
    private final String value;

    public InvalidOptionException(String option, String value, String reason) {
        super("Invalid value for '" + option + "'" + (value == null ? "" : " (" + value + ")") + ": " + reason);
        this.option = option;
        this.value = value;
    }

    public String getOption() {
        return option;
    }

    public String getValue() {
        return value;
    }
}
