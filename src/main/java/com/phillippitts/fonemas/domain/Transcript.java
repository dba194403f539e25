package com.phillippitts.fonemas.domain;

import java.util.List;
import java.util.Objects;

/**
 * One representation of a sentence (phonology, phonetics or SAMPA).
 *
 * <p>{@code syllables} is the order-preserving concatenation of the syllables of every
 * word; it is never reordered independently of {@code words}.
 *
 * @param words     one transcribed string per input word
 * @param syllables flattened syllables of all words, in order
 */
public record Transcript(List<String> words, List<String> syllables) {

    private static final Transcript EMPTY = new Transcript(List.of(), List.of());

    public Transcript {
        Objects.requireNonNull(words, "words must not be null");
        Objects.requireNonNull(syllables, "syllables must not be null");
        words = List.copyOf(words);
        syllables = List.copyOf(syllables);
    }

    public static Transcript empty() {
        return EMPTY;
    }

    /**
     * Returns a copy with the same words and the given syllables.
     */
    public Transcript withSyllables(List<String> newSyllables) {
        return new Transcript(words, newSyllables);
    }
}
