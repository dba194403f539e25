package com.phillippitts.fonemas.service.rehash;

import com.phillippitts.fonemas.service.rules.IpaSymbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resyllabifies across word boundaries: a consonant closing one syllable moves onto the next
 * syllable when that syllable starts with a vowel or glide ("sol ar" is spoken "so lar").
 *
 * <p>A single forward pass; a moved consonant exposes the donor's new last character, so the
 * effect cascades through chains such as mar-es-ol → ma-re-sol. Syllable count and total
 * character count never change. A one-character syllable never donates.
 */
public class SyllableRehasher {

    /**
     * @param syllables flattened syllables (must not be null); not modified
     * @return a new list with the boundaries moved
     */
    public List<String> rehash(List<String> syllables) {
        Objects.requireNonNull(syllables, "syllables must not be null");
        List<String> result = new ArrayList<>(syllables);
        for (int i = 1; i < result.size(); i++) {
            String donor = result.get(i - 1);
            String receiver = result.get(i);
            if (donor.length() <= 1 || receiver.isEmpty()) {
                continue;
            }
            char last = donor.charAt(donor.length() - 1);
            if (isVowel(receiver.charAt(0)) && !isVowel(last)) {
                result.set(i - 1, donor.substring(0, donor.length() - 1));
                result.set(i, last + receiver);
            }
        }
        return result;
    }

    private static boolean isVowel(char c) {
        return IpaSymbols.VOWELS_AND_GLIDES.indexOf(c) >= 0;
    }
}
