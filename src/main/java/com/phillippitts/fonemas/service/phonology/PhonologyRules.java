package com.phillippitts.fonemas.service.phonology;

import com.phillippitts.fonemas.service.rules.IpaSymbols;
import com.phillippitts.fonemas.service.rules.RewriteRule;
import com.phillippitts.fonemas.service.rules.RuleTable;

import java.util.Set;

/**
 * Orthography to phonology rule tables. Every table is applied in declaration order.
 *
 * <p>Word boundaries are written as {@code (?<!\S)} and {@code (?!\S)}: the transducer works
 * one word at a time and accented letters or IPA symbols must not count as boundaries.
 */
public final class PhonologyRules {

    /** Place names and surnames whose x is read as the jota. */
    public static final Set<String> X_AS_JOTA = Set.of(
            "mexico", "mexicos", "mexicano", "mexicanos", "mexicana", "mexicanas",
            "oaxaca", "oaxaqueño", "oaxaqueños", "oaxaqueña", "oaxaqueñas",
            "texas", "texano", "texanos", "texana", "texanas",
            "ximena", "ximenez", "mexia");

    /** Word-initial x that survived the exception list sounds as s (xilófono). */
    public static final RewriteRule WORD_INITIAL_X =
            RewriteRule.of("(?<!\\S)x", "s", "word-initial x read as s");

    /**
     * Marks the trill with the placeholder R: r at word start, after n, l or s (honra,
     * alrededor, israel), and the digraph rr. Any r left unmarked later becomes the tap.
     */
    public static final RewriteRule TRILL =
            RewriteRule.of("(?<![^\\snls])r|rr", "R", "trill r marked with a placeholder");

    /** Word-initial h realised as aspiration when requested. */
    public static final RewriteRule ASPIRATION =
            RewriteRule.of("(?<!\\S)h", "ʰ", "word-initial h aspirated");

    /**
     * Consonant graphemes to phonemes. Order is significant: x becomes ks before j becomes x,
     * the tap is written before the trill placeholder is resolved, the c + front vowel keys
     * come before ch and plain c, and "hie" before the silent h.
     */
    public static final RuleTable CONSONANTS = RuleTable.of("consonants",
            RewriteRule.literal("w", "b", "w read as b"),
            RewriteRule.literal("v", "b", "no b/v distinction"),
            RewriteRule.literal("z", "θ", "z is the interdental fricative"),
            RewriteRule.literal("ñ", "ɲ", "palatal nasal"),
            RewriteRule.literal("x", "ks", "x is the ks cluster"),
            RewriteRule.literal("j", "x", "jota is the velar fricative"),
            RewriteRule.literal("r", "ɾ", "unmarked r is the tap"),
            RewriteRule.literal("R", "r", "trill placeholder resolved"),
            RewriteRule.literal("ce", "θe", "c before front vowel"),
            RewriteRule.literal("cé", "θé", "c before front vowel"),
            RewriteRule.literal("cë", "θë", "c before front vowel"),
            RewriteRule.literal("ci", "θi", "c before front vowel"),
            RewriteRule.literal("cí", "θí", "c before front vowel"),
            RewriteRule.literal("cï", "θï", "c before front vowel"),
            RewriteRule.literal("cj", "θj", "c before glide"),
            RewriteRule.literal("ch", "ʧ", "ch is the affricate"),
            RewriteRule.literal("c", "k", "remaining c is k"),
            RewriteRule.literal("qu", "k", "qu is k"),
            RewriteRule.literal("ll", "ʎ", "ll is the palatal lateral"),
            RewriteRule.literal("ph", "f", "ph is f"),
            RewriteRule.literal("hie", "ʝe", "hie starts with the palatal fricative"),
            RewriteRule.literal("h", "", "h is silent"));

    /** Rules for y; only run when the word still contains a y. */
    public static final RuleTable Y_RULES = RuleTable.of("y",
            RewriteRule.of("(?<!\\S)y(?!\\S)", "i", "conjunction y is a vowel"),
            RewriteRule.of("uy(?!\\S)", "wi", "final uy (muy) is glide + vowel"),
            RewriteRule.of("y(?!\\S)", "j", "final y (hay, rey) is an off-glide"),
            RewriteRule.literal("y", "ʝ", "other y is the palatal fricative"),
            RewriteRule.of("aʝ(?!\\S)", "ái", "vowel + final palatal fricative is a stressed diphthong"),
            RewriteRule.of("eʝ(?!\\S)", "éi", "vowel + final palatal fricative is a stressed diphthong"),
            RewriteRule.of("uʝ(?!\\S)", "úi", "vowel + final palatal fricative is a stressed diphthong"),
            RewriteRule.of("iʝ(?!\\S)", "íi", "vowel + final palatal fricative is a stressed diphthong"),
            RewriteRule.of("oʝ(?!\\S)", "ói", "vowel + final palatal fricative is a stressed diphthong"),
            RewriteRule.of("ʝ(?![aeiouáéíóú])", "i", "palatal fricative without a following vowel is i"));

    /** Rules for g; only run when the word still contains a g. */
    public static final RuleTable G_RULES = RuleTable.of("g",
            RewriteRule.of("g([eiéíëï])", "x$1", "g before front vowel is the velar fricative"),
            RewriteRule.of("gu([eiéíëï])", "g$1", "u of gue/gui is silent"),
            RewriteRule.of("gü([eiéí])", "gw$1", "güe/güi pronounce the u as a glide"),
            RewriteRule.of("gu([aoáó])", "gw$1", "gua/guo pronounce the u as a glide"));

    /**
     * Diphthongs inside a syllable: a high vowel next to another vowel becomes a glide.
     * Falling diphthongs are resolved before rising ones.
     */
    public static final RuleTable DIPHTHONGS = RuleTable.of("diphthongs",
            RewriteRule.of("([aeoáéó])i", "$1j", "falling diphthong with i"),
            RewriteRule.of("([aeioáéó])u", "$1w", "falling diphthong with u"),
            RewriteRule.of("i([aeoáéó])", "j$1", "rising diphthong with i"),
            RewriteRule.of("u([aeoiáéó])", "w$1", "rising diphthong with u"));

    /** Removes written accents and the hiatus placeholder once stress has been marked. */
    public static final RuleTable ACCENT_STRIPPING = RuleTable.of("accents",
            RewriteRule.literal("á", "a", "accent removed"),
            RewriteRule.literal("à", "a", "accent removed"),
            RewriteRule.literal("ä", "a", "diaeresis removed"),
            RewriteRule.literal("é", "e", "accent removed"),
            RewriteRule.literal("è", "e", "accent removed"),
            RewriteRule.literal("ë", "e", "diaeresis removed"),
            RewriteRule.literal("ú", "u", "accent removed"),
            RewriteRule.literal("ù", "u", "accent removed"),
            RewriteRule.literal("ü", "u", "diaeresis removed"),
            RewriteRule.literal("í", "i", "accent removed"),
            RewriteRule.literal("ì", "i", "accent removed"),
            RewriteRule.literal("ï", "i", "diaeresis removed"),
            RewriteRule.literal("ó", "o", "accent removed"),
            RewriteRule.literal("ò", "o", "accent removed"),
            RewriteRule.literal("ö", "o", "diaeresis removed"),
            RewriteRule.literal(IpaSymbols.HIATUS_PLACEHOLDER, "", "hiatus placeholder removed"));

    /** Adverbs are syllabified on the root and then get these two syllables. */
    static final String MENTE = "mente";
    static final String MENTE_FIRST_SYLLABLE = IpaSymbols.SECONDARY_STRESS + "men";
    static final String MENTE_SECOND_SYLLABLE = "te";

    private PhonologyRules() {
    }
}
