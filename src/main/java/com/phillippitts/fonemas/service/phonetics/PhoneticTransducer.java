package com.phillippitts.fonemas.service.phonetics;

import com.phillippitts.fonemas.domain.Transcript;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives the phonetic transcription from the phonological one by applying the allophone
 * table and then the coarticulation table.
 *
 * <p>Words and syllables are processed separately: words joined with spaces, syllables joined
 * with hyphens so rules can look across syllable boundaries. Both strings are split back
 * afterwards, so the word and syllable counts of the input are kept.
 */
public class PhoneticTransducer {

    private static final Logger LOG = LogManager.getLogger(PhoneticTransducer.class);

    /**
     * @param phonology phonological transcript (must not be null)
     * @return phonetic transcript
     */
    public Transcript transcribe(Transcript phonology) {
        Objects.requireNonNull(phonology, "phonology must not be null");
        List<String> words = substitute(String.join(" ", phonology.words()));
        List<String> syllables = substitute(String.join("-", phonology.syllables()));
        LOG.debug("Phonetics produced {} words, {} syllables", words.size(), syllables.size());
        return new Transcript(words, syllables);
    }

    private static List<String> substitute(String joined) {
        String text = PhoneticRules.ALLOPHONES.apply(joined);
        text = PhoneticRules.COARTICULATION.apply(text);

        List<String> tokens = new ArrayList<>();
        for (String token : text.replace('-', ' ').split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
