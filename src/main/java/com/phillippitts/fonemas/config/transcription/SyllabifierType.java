package com.phillippitts.fonemas.config.transcription;

/**
 * Syllabifier implementations that can be selected with {@code fonemas.syllabifier.type}.
 */
public enum SyllabifierType {
    /** Rule-based Spanish syllabifier shipped with the application. */
    BUILTIN
}
