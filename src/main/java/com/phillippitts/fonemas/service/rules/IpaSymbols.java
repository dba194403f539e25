package com.phillippitts.fonemas.service.rules;

/**
 * IPA symbols shared by several pipeline stages.
 */
public final class IpaSymbols {

    /** Primary stress mark, written before the stressed syllable. */
    public static final String PRIMARY_STRESS = "ˈ";

    /** Secondary stress mark, only produced for -mente adverbs. */
    public static final String SECONDARY_STRESS = "ˌ";

    /** Marks a diaeresis vowel until accents are stripped; forces a hiatus. */
    public static final String HIATUS_PLACEHOLDER = "_";

    /** Vowels and glides as they appear in phonological syllables. */
    public static final String VOWELS_AND_GLIDES = "aeioujwăĕŏ";

    private IpaSymbols() {
    }
}
