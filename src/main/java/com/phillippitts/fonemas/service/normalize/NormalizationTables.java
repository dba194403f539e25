package com.phillippitts.fonemas.service.normalize;

import com.phillippitts.fonemas.service.rules.RewriteRule;
import com.phillippitts.fonemas.service.rules.RuleTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Constant tables used to clean raw text before transcription.
 */
public final class NormalizationTables {

    /** Characters that count as letters when deciding whether a letter stands alone. */
    static final String LETTER_CLASS = "[a-záéíóúñü]";

    /**
     * Spoken names of letters that may appear on their own ("b" is read "be").
     * Ordered: "c" is tried before "ch" and "l" before "ll", so a digraph is only named
     * when it stands alone as a whole.
     */
    static final String[][] LETTER_NAMES = {
            {"b", "be"},
            {"c", "θe"},
            {"ch", "ʧe"},
            {"d", "de"},
            {"f", "efe"},
            {"g", "ge"},
            {"h", "haʧe"},
            {"j", "jota"},
            {"k", "ka"},
            {"l", "ele"},
            {"ll", "eʎe"},
            {"m", "eme"},
            {"n", "ene"},
            {"p", "pe"},
            {"q", "ku"},
            {"r", "erre"},
            {"s", "ese"},
            {"t", "te"},
            {"v", "ube"},
            {"w", "ubedoble"},
            {"x", "ekis"},
            {"z", "θeta"}
    };

    /** Punctuation and quotes replaced by a space. */
    static final List<String> SYMBOLS = List.of(
            "(", ")", "¿", "?", "¡", "!", "«", "»", "\"",
            "“", "‘", "’", "[", "]", "—", "…",
            ",", ";", ":", "'", ".", "–", "”", "-");

    /**
     * Non-standard diacritics mapped to standard Spanish forms. A diaeresis on a, e, i, o
     * becomes an underscore placeholder in front of the vowel; the syllabifier reads it as a
     * forced hiatus and the phonological transducer removes it afterwards.
     */
    static final String[][] DIACRITICS = {
            {"à", "á"},
            {"è", "é"},
            {"ì", "í"},
            {"ò", "ó"},
            {"ù", "ú"},
            {"æ", "e"},
            {"ä", "_a"},
            {"ë", "_e"},
            {"ï", "_i"},
            {"ö", "_o"},
            {"ã", "á"},
            {"õ", "ó"},
            {"â", "a"},
            {"ê", "e"},
            {"î", "i"},
            {"ô", "o"},
            {"û", "u"},
            {"ç", "θ"}
    };

    public static final RuleTable ISOLATED_LETTERS = isolatedLetters();

    public static final RewriteRule STRIP_SYMBOLS = stripSymbols();

    public static final RuleTable DIACRITIC_NORMALIZATION = diacritics();

    /** Prosthetic "e" before word-initial s that is not followed by a vowel (spiritu → espiritu). */
    public static final RewriteRule EPENTHESIS =
            RewriteRule.of("(?<!\\S)s(?![aeiouáéíóú])", "es", "epenthetic e before word-initial s + consonant");

    private NormalizationTables() {
    }

    private static RuleTable isolatedLetters() {
        List<RewriteRule> rules = new ArrayList<>();
        for (String[] entry : LETTER_NAMES) {
            rules.add(RewriteRule.of(
                    "(?<!" + LETTER_CLASS + ")" + Pattern.quote(entry[0]) + "(?!" + LETTER_CLASS + ")",
                    entry[1],
                    "isolated letter '" + entry[0] + "' read by its name"));
        }
        return RuleTable.of("isolated-letters", rules);
    }

    private static RewriteRule stripSymbols() {
        StringBuilder alternatives = new StringBuilder();
        for (String symbol : SYMBOLS) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(symbol));
        }
        return RewriteRule.of(alternatives.toString(), " ", "punctuation becomes a word separator");
    }

    private static RuleTable diacritics() {
        List<RewriteRule> rules = new ArrayList<>();
        for (String[] entry : DIACRITICS) {
            rules.add(RewriteRule.literal(entry[0], entry[1], "diacritic '" + entry[0] + "' normalized"));
        }
        return RuleTable.of("cleaning-diacritics", rules);
    }
}
