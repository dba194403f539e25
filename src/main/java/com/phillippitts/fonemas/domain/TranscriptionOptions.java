package com.phillippitts.fonemas.domain;

import com.phillippitts.fonemas.exception.InvalidOptionException;

import java.util.Objects;

/**
 * Per-request transcription options.
 *
 * @param mono       mark stress on monosyllables
 * @param exceptions exception level handed to the syllabifier
 * @param epenthesis insert "e" before word-initial s + consonant
 * @param aspiration mark word-initial h as aspiration instead of deleting it
 * @param rehash     move syllable-final consonants onto a following vowel-initial syllable
 * @param stress     primary stress marker used in SAMPA output
 */
public record TranscriptionOptions(
        boolean mono,
        ExceptionLevel exceptions,
        boolean epenthesis,
        boolean aspiration,
        boolean rehash,
        String stress
) {

    public static final String DEFAULT_STRESS = "\"";

    private static final TranscriptionOptions DEFAULTS =
            new TranscriptionOptions(false, ExceptionLevel.BASIC, false, false, false, DEFAULT_STRESS);

    /**
     * @throws NullPointerException if exceptions or stress is null
     * @throws InvalidOptionException if the stress marker is empty
     */
    public TranscriptionOptions {
        Objects.requireNonNull(exceptions, "exceptions must not be null");
        Objects.requireNonNull(stress, "stress must not be null");
        if (stress.isEmpty()) {
            throw new InvalidOptionException("stress", stress, "stress marker must not be empty");
        }
    }

    public static TranscriptionOptions defaults() {
        return DEFAULTS;
    }

    public TranscriptionOptions withMono(boolean value) {
        return new TranscriptionOptions(value, exceptions, epenthesis, aspiration, rehash, stress);
    }

    public TranscriptionOptions withExceptions(ExceptionLevel value) {
        return new TranscriptionOptions(mono, value, epenthesis, aspiration, rehash, stress);
    }

    public TranscriptionOptions withEpenthesis(boolean value) {
        return new TranscriptionOptions(mono, exceptions, value, aspiration, rehash, stress);
    }

    public TranscriptionOptions withAspiration(boolean value) {
        return new TranscriptionOptions(mono, exceptions, epenthesis, value, rehash, stress);
    }

    public TranscriptionOptions withRehash(boolean value) {
        return new TranscriptionOptions(mono, exceptions, epenthesis, aspiration, value, stress);
    }

    public TranscriptionOptions withStress(String value) {
        return new TranscriptionOptions(mono, exceptions, epenthesis, aspiration, rehash, value);
    }
}
