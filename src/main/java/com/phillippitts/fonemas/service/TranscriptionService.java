package com.phillippitts.fonemas.service;

import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.domain.TranscriptionResult;

/**
 * Transcribes Spanish text into its phonological, phonetic and SAMPA representations.
 *
 * <p>Implementations must be thread-safe: independent calls share no mutable state.
 */
public interface TranscriptionService {

    /**
     * Transcribes text with the given options.
     *
     * @param text    raw input text (must not be null; may be empty)
     * @param options transcription options (must not be null)
     * @return the cleaned sentence and its three representations
     * @throws com.phillippitts.fonemas.exception.TranscriptionException if a word cannot be
     *         syllabified; the cause is the
     *         {@link com.phillippitts.fonemas.exception.SyllabificationException}
     */
    TranscriptionResult transcribe(String text, TranscriptionOptions options);

    /**
     * Transcribes text with the service's default options.
     *
     * @param text raw input text (must not be null)
     * @return the transcription result
     */
    TranscriptionResult transcribe(String text);

    /**
     * @return the options used by {@link #transcribe(String)}
     */
    TranscriptionOptions defaultOptions();
}
