package com.phillippitts.fonemas.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cleaned sentence produced by the normalizer: the cleaned text plus its ordered,
 * space-delimited words.
 *
 * @param text  the cleaned text exactly as the normalizer produced it
 * @param words the non-empty whitespace-separated tokens of {@code text}, in order
 */
public record Sentence(String text, List<String> words) {

    public Sentence {
        Objects.requireNonNull(text, "Sentence text must not be null");
        Objects.requireNonNull(words, "Sentence words must not be null");
        words = List.copyOf(words);
    }

    /**
     * Splits cleaned text into words on runs of whitespace, dropping empty tokens.
     *
     * @param text cleaned text
     * @return sentence wrapping the text and its words
     */
    public static Sentence of(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<String> words = new ArrayList<>();
        for (String token : text.split("\\s+")) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }
        return new Sentence(text, words);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }
}
