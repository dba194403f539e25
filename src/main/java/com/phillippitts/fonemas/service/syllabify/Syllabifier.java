package com.phillippitts.fonemas.service.syllabify;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.Syllabification;

/**
 * Capability that splits one word into syllables and locates its stress.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>the returned syllables concatenate back to {@code word} exactly, accents included</li>
 *   <li>the stress value is a valid forward index or a negative index counted from the end</li>
 *   <li>a word that cannot be syllabified (no vowel nucleus) raises
 *       {@link com.phillippitts.fonemas.exception.SyllabificationException}</li>
 * </ul>
 *
 * <p>The input is a single lower-case word as the phonological transducer has rewritten it: a
 * mix of Spanish letters with acute accents and IPA consonant symbols, possibly containing the
 * {@code _} hiatus placeholder. Implementations must be stateless and thread-safe.
 */
public interface Syllabifier {

    /**
     * @param word  word to split (must not be null)
     * @param level how many lexical exceptions to apply; opaque to callers
     * @return syllables and stress position
     */
    Syllabification syllabify(String word, ExceptionLevel level);
}
