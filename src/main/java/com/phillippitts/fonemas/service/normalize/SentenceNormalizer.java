package com.phillippitts.fonemas.service.normalize;

import com.phillippitts.fonemas.domain.Sentence;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Cleans raw text into a sentence the phonological transducer can consume.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>lower-case the text</li>
 *   <li>replace letters standing alone by their spoken names</li>
 *   <li>replace punctuation and quotes by spaces, so neighbouring words never fuse</li>
 *   <li>normalize non-standard diacritics</li>
 *   <li>optionally insert an epenthetic "e" before word-initial s + consonant</li>
 * </ol>
 *
 * <p>Never fails: characters no table mentions pass through unchanged. Stateless and thread-safe.
 */
public class SentenceNormalizer {

    private static final Logger LOG = LogManager.getLogger(SentenceNormalizer.class);

    /**
     * @param raw        text to clean (must not be null)
     * @param epenthesis whether to insert the epenthetic vowel
     * @return the cleaned sentence
     */
    public Sentence normalize(String raw, boolean epenthesis) {
        Objects.requireNonNull(raw, "raw text must not be null");

        String text = raw.toLowerCase(Locale.ROOT);
        text = NormalizationTables.ISOLATED_LETTERS.apply(text);
        text = NormalizationTables.STRIP_SYMBOLS.apply(text);
        text = NormalizationTables.DIACRITIC_NORMALIZATION.apply(text);
        if (epenthesis) {
            text = NormalizationTables.EPENTHESIS.apply(text);
        }

        Sentence sentence = Sentence.of(text);
        LOG.debug("Normalized input into {} words (epenthesis={})", sentence.size(), epenthesis);
        return sentence;
    }
}
