package com.phillippitts.fonemas.exception;

/**
 * Thrown when the syllabifier rejects a word, typically because it has no vowel nucleus
 * or because the stress position it reports lies outside the syllable list.
 *
 * <p>This is the only failure a transcription can raise once the input has been accepted;
 * it aborts the whole transcription.
 */
public class SyllabificationException extends FonemasException {

    private final String word;
    private final String reason;

    public SyllabificationException(String word, String reason) {
        super("Cannot syllabify '" + word + "': " + reason);
        this.word = word;
        this.reason = reason;
    }

    public String getWord() {
        return word;
    }

    public String getReason() {
        return reason;
    }
}
