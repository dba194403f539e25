package com.phillippitts.fonemas.service.phonology;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.Sentence;
import com.phillippitts.fonemas.domain.Syllabification;
import com.phillippitts.fonemas.domain.Transcript;
import com.phillippitts.fonemas.domain.TranscriptionOptions;
import com.phillippitts.fonemas.service.rules.IpaSymbols;
import com.phillippitts.fonemas.service.syllabify.Syllabifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a cleaned sentence into its phonological transcription.
 *
 * <p>Every word is rewritten on its own so that one input word always yields exactly one
 * output word:
 * <ol>
 *   <li>x exceptions (México, Texas) and word-initial x</li>
 *   <li>trill detection, optional aspiration of word-initial h, consonant table</li>
 *   <li>y and g context rules</li>
 *   <li>syllabification, with -mente adverbs split into root plus ˌmen-te</li>
 *   <li>glide formation inside each syllable, primary stress mark, accent removal</li>
 * </ol>
 *
 * <p>{@link com.phillippitts.fonemas.exception.SyllabificationException} from the syllabifier
 * is propagated unchanged.
 */
public class PhonologicalTransducer {

    private static final Logger LOG = LogManager.getLogger(PhonologicalTransducer.class);

    private final Syllabifier syllabifier;

    public PhonologicalTransducer(Syllabifier syllabifier) {
        this.syllabifier = Objects.requireNonNull(syllabifier, "syllabifier must not be null");
    }

    /**
     * @param sentence cleaned sentence (must not be null)
     * @param options  transcription options (must not be null)
     * @return phonological words and the flattened syllables of all words
     */
    public Transcript transcribe(Sentence sentence, TranscriptionOptions options) {
        Objects.requireNonNull(sentence, "sentence must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<String> words = new ArrayList<>(sentence.size());
        List<String> syllables = new ArrayList<>();
        for (String word : sentence.words()) {
            List<String> wordSyllables = transcribeWord(word, options);
            words.add(PhonologyRules.ACCENT_STRIPPING.apply(String.join("", wordSyllables)));
            for (String syllable : wordSyllables) {
                syllables.add(PhonologyRules.ACCENT_STRIPPING.apply(syllable));
            }
        }
        LOG.debug("Phonology produced {} words, {} syllables", words.size(), syllables.size());
        return new Transcript(words, syllables);
    }

    private List<String> transcribeWord(String word, TranscriptionOptions options) {
        String rewritten = rewriteConsonants(word, options.aspiration());
        Syllabification syllabification = syllabify(rewritten, options.exceptions());

        List<String> syllables = new ArrayList<>(syllabification.syllables().size());
        for (String syllable : syllabification.syllables()) {
            syllables.add(PhonologyRules.DIPHTHONGS.apply(syllable));
        }

        if (syllables.size() > 1 || options.mono()) {
            int stressed = syllabification.stressIndex();
            syllables.set(stressed, IpaSymbols.PRIMARY_STRESS + syllables.get(stressed));
        }
        return syllables;
    }

    private static String rewriteConsonants(String word, boolean aspiration) {
        String result = word;
        if (result.indexOf('x') >= 0) {
            if (PhonologyRules.X_AS_JOTA.contains(result)) {
                result = result.replace('x', 'j');
            }
            result = PhonologyRules.WORD_INITIAL_X.apply(result);
        }
        result = PhonologyRules.TRILL.apply(result);
        if (aspiration) {
            result = PhonologyRules.ASPIRATION.apply(result);
        }
        result = PhonologyRules.CONSONANTS.apply(result);
        if (result.indexOf('y') >= 0) {
            result = PhonologyRules.Y_RULES.apply(result);
        }
        if (result.indexOf('g') >= 0) {
            result = PhonologyRules.G_RULES.apply(result);
        }
        return result;
    }

    /**
     * Syllabifies the word, keeping the -mente suffix out of the syllabifier's reach. A
     * one-syllable root is treated as unstressed and the primary stress is put in front of the
     * secondary mark of "men" (ˈˌmen).
     * The returned stress is always a forward index.
     */
    private Syllabification syllabify(String word, ExceptionLevel level) {
        if (word.length() > PhonologyRules.MENTE.length() && word.endsWith(PhonologyRules.MENTE)) {
            String root = word.substring(0, word.length() - PhonologyRules.MENTE.length());
            Syllabification rootSyllables = syllabifier.syllabify(root, level);
            List<String> syllables = new ArrayList<>(rootSyllables.syllables());
            syllables.add(PhonologyRules.MENTE_FIRST_SYLLABLE);
            syllables.add(PhonologyRules.MENTE_SECOND_SYLLABLE);
            int stress = rootSyllables.syllables().size() > 1
                    ? rootSyllables.stressIndex()
                    : rootSyllables.syllables().size();
            return new Syllabification(syllables, stress);
        }
        Syllabification result = syllabifier.syllabify(word, level);
        return new Syllabification(result.syllables(), result.stressIndex());
    }
}
