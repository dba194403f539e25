package com.phillippitts.fonemas.domain;

import com.phillippitts.fonemas.exception.SyllabificationException;

import java.util.List;
import java.util.Objects;

/**
 * Output of a syllabifier for one word.
 *
 * @param syllables ordered syllables; their concatenation is the syllabified word
 * @param stress    stressed syllable, either a forward index or a negative index counted
 *                  from the end (-1 is the last syllable)
 */
public record Syllabification(List<String> syllables, int stress) {

    public Syllabification {
        Objects.requireNonNull(syllables, "syllables must not be null");
        syllables = List.copyOf(syllables);
    }

    /**
     * Resolves {@link #stress()} into a forward index.
     *
     * @return index into {@link #syllables()} of the stressed syllable
     * @throws SyllabificationException if the index falls outside the syllable list
     */
    public int stressIndex() {
        int index = stress < 0 ? syllables.size() + stress : stress;
        if (index < 0 || index >= syllables.size()) {
            throw new SyllabificationException(String.join("", syllables),
                    "stress index " + stress + " out of range for " + syllables.size() + " syllables");
        }
        return index;
    }

    public String word() {
        return String.join("", syllables);
    }
}
