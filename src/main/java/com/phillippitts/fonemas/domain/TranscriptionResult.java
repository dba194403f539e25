package com.phillippitts.fonemas.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of transcribing one text: the cleaned sentence and its three
 * aligned representations.
 *
 * @param sentence  the cleaned input sentence
 * @param phonology abstract phonological transcription (IPA)
 * @param phonetics surface phonetic transcription with allophones (IPA)
 * @param sampa     ASCII transliteration of the phonetic transcription
 */
public record TranscriptionResult(
        String sentence,
        Transcript phonology,
        Transcript phonetics,
        Transcript sampa
) {

    /**
     * @throws NullPointerException if any component is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(sentence, "Sentence must not be null");
        Objects.requireNonNull(phonology, "Phonology must not be null");
        Objects.requireNonNull(phonetics, "Phonetics must not be null");
        Objects.requireNonNull(sampa, "SAMPA must not be null");
    }

    /**
     * @param format representation to return
     * @return the transcript for that representation
     */
    public Transcript transcript(Format format) {
        return switch (format) {
            case PHONOLOGY -> phonology;
            case PHONETICS -> phonetics;
            case SAMPA -> sampa;
        };
    }

    /**
     * All three representations, in phonology, phonetics, SAMPA order.
     */
    public Map<Format, Transcript> all() {
        Map<Format, Transcript> all = new LinkedHashMap<>();
        for (Format format : Format.values()) {
            all.put(format, transcript(format));
        }
        return Collections.unmodifiableMap(all);
    }
}
