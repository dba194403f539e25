package com.phillippitts.fonemas.service.syllabify;

import com.phillippitts.fonemas.domain.ExceptionLevel;
import com.phillippitts.fonemas.domain.Syllabification;
import com.phillippitts.fonemas.exception.SyllabificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Rule-based Spanish syllabifier.
 *
 * <p>Works in two passes over the word:
 * <ol>
 *   <li>vowel runs are grouped into nuclei. A nucleus holds at most one strong vowel
 *       (a, e, o or an accented vowel); the glides j and w and unaccented i, u, ü join
 *       the neighbouring vowel, and {@code _} always opens a new nucleus</li>
 *   <li>consonants between two nuclei are split so the next syllable gets the longest legal
 *       onset: a single consonant, or an obstruent followed by l or ɾ (except tl and dl)</li>
 * </ol>
 *
 * <p>Stress follows the written-accent rules: an accented vowel wins, otherwise words ending in
 * a vowel, or in n or s after a vowel, are stressed on the penultimate syllable, and the rest
 * on the last one. Positions are reported counted from the end of the word.
 *
 * <p>With {@link ExceptionLevel#BASIC} known prefixes keep their morpheme boundary
 * (sub-al-ter-no); {@link ExceptionLevel#EXTENDED} also splits listed hiatuses (cru-el).
 */
public class SpanishSyllabifier implements Syllabifier {

    private static final Logger LOG = LogManager.getLogger(SpanishSyllabifier.class);

    private static final String VOWELS = "aeiouüáéíóú";
    private static final String STRONG_VOWELS = "aeoáéóíú";
    private static final String ACCENTED_VOWELS = "áéíóú";
    private static final String GLIDES = "jw";
    private static final String ONSET_FIRST = "pbtdkgf";
    private static final String ONSET_SECOND = "lɾ";
    private static final char HIATUS = '_';

    @Override
    public Syllabification syllabify(String word, ExceptionLevel level) {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(level, "level must not be null");

        int forced = forcedBoundary(word, level);
        List<int[]> nuclei = findNuclei(word, forced);
        if (nuclei.isEmpty()) {
            throw new SyllabificationException(word, "no vowel nucleus");
        }

        List<String> syllables = split(word, nuclei, forced);
        int stress = stressFromEnd(word, syllables);
        LOG.trace("Syllabified '{}' as {} (stress {})", word, syllables, stress);
        return new Syllabification(syllables, stress);
    }

    private static int forcedBoundary(String word, ExceptionLevel level) {
        if (level.level() >= ExceptionLevel.BASIC.level()) {
            OptionalInt prefix = SyllabifierExceptions.prefixBoundary(word);
            if (prefix.isPresent()) {
                return prefix.getAsInt();
            }
        }
        if (level.level() >= ExceptionLevel.EXTENDED.level()) {
            OptionalInt hiatus = SyllabifierExceptions.hiatusBoundary(word);
            if (hiatus.isPresent()) {
                return hiatus.getAsInt();
            }
        }
        return -1;
    }

    /**
     * Returns {start, end} spans of every nucleus, in order.
     */
    private static List<int[]> findNuclei(String word, int forced) {
        List<int[]> nuclei = new ArrayList<>();
        int i = 0;
        while (i < word.length()) {
            if (!isVocalic(word.charAt(i))) {
                i++;
                continue;
            }
            int end = i;
            while (end < word.length() && isVocalic(word.charAt(end))) {
                end++;
            }
            splitRun(word, i, end, forced, nuclei);
            i = end;
        }
        return nuclei;
    }

    private static void splitRun(String word, int start, int end, int forced, List<int[]> nuclei) {
        List<int[]> groups = new ArrayList<>();
        int groupStart = start;
        boolean hasStrong = isStrong(word.charAt(start));
        for (int k = start + 1; k < end; k++) {
            char prev = word.charAt(k - 1);
            char c = word.charAt(k);
            boolean split;
            if (k == forced || c == HIATUS) {
                split = true;
            } else if (prev == HIATUS || isGlide(prev) || isGlide(c)) {
                split = false;
            } else if (isStrong(c)) {
                split = hasStrong;
            } else {
                split = !isStrong(prev) && prev == c;
            }
            if (split) {
                groups.add(new int[]{groupStart, k});
                groupStart = k;
                hasStrong = false;
            }
            hasStrong |= isStrong(c);
        }
        groups.add(new int[]{groupStart, end});

        // a group without a real vowel (lone glides, a trailing placeholder) cannot carry a syllable
        List<int[]> merged = new ArrayList<>();
        for (int[] group : groups) {
            if (containsVowel(word, group)) {
                merged.add(group);
            } else if (!merged.isEmpty()) {
                merged.get(merged.size() - 1)[1] = group[1];
            } else {
                merged.add(group);
            }
        }
        if (merged.size() > 1 && !containsVowel(word, merged.get(0))) {
            merged.get(1)[0] = merged.get(0)[0];
            merged.remove(0);
        }
        for (int[] group : merged) {
            if (containsVowel(word, group)) {
                nuclei.add(group);
            }
        }
    }

    private static List<String> split(String word, List<int[]> nuclei, int forced) {
        List<String> syllables = new ArrayList<>(nuclei.size());
        int start = 0;
        for (int n = 1; n < nuclei.size(); n++) {
            int consonantsStart = nuclei.get(n - 1)[1];
            int nucleusStart = nuclei.get(n)[0];
            int next = onsetStart(word, consonantsStart, nucleusStart, forced);
            syllables.add(word.substring(start, next));
            start = next;
        }
        syllables.add(word.substring(start));
        return syllables;
    }

    private static int onsetStart(String word, int consonantsStart, int nucleusStart, int forced) {
        if (forced >= consonantsStart && forced <= nucleusStart) {
            return forced;
        }
        int count = nucleusStart - consonantsStart;
        if (count <= 1) {
            return consonantsStart;
        }
        char first = word.charAt(nucleusStart - 2);
        char second = word.charAt(nucleusStart - 1);
        return isOnsetCluster(first, second) ? nucleusStart - 2 : nucleusStart - 1;
    }

    private static boolean isOnsetCluster(char first, char second) {
        if (ONSET_FIRST.indexOf(first) < 0 || ONSET_SECOND.indexOf(second) < 0) {
            return false;
        }
        return !(second == 'l' && (first == 't' || first == 'd'));
    }

    private static int stressFromEnd(String word, List<String> syllables) {
        int count = syllables.size();
        if (count == 1) {
            return -1;
        }
        for (int i = 0; i < count; i++) {
            if (containsAny(syllables.get(i), ACCENTED_VOWELS)) {
                return i - count;
            }
        }
        char last = word.charAt(word.length() - 1);
        if (isVowel(last)) {
            return -2;
        }
        if ((last == 'n' || last == 's') && word.length() > 1 && isVowel(word.charAt(word.length() - 2))) {
            return -2;
        }
        return -1;
    }

    private static boolean containsVowel(String word, int[] span) {
        for (int i = span[0]; i < span[1]; i++) {
            if (isVowel(word.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isVocalic(char c) {
        return isVowel(c) || isGlide(c) || c == HIATUS;
    }

    private static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    private static boolean isStrong(char c) {
        return STRONG_VOWELS.indexOf(c) >= 0;
    }

    private static boolean isGlide(char c) {
        return GLIDES.indexOf(c) >= 0;
    }
}
